package io.github.drompincen.mockjira.runtime.query;

import io.github.drompincen.mockjira.runtime.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueryEvaluatorTest {

    private QueryEvaluator evaluator;
    private AttributeSet item;

    @BeforeEach
    void setUp() {
        evaluator = new QueryEvaluator(MutableClock.at("2024-05-01T10:00:00Z"));
        item = new AttributeSet(Map.of(
                "project", List.of("dev", "10000", "development"),
                "status", List.of("in progress", "3"),
                "assignee", List.of("alice-id", "alice johnson", "alice@example.com"),
                "reporter", List.of(),
                "labels", List.of("backend", "p1")),
                Instant.parse("2024-04-28T09:00:00Z"),
                Instant.parse("2024-04-30T09:00:00Z"));
    }

    @Test
    void equalityMatchesAnySpellingIgnoringCase() {
        assertThat(matches("project = DEV")).isTrue();
        assertThat(matches("project = 10000")).isTrue();
        assertThat(matches("status = \"In Progress\"")).isTrue();
        assertThat(matches("project = SUP")).isFalse();
    }

    @Test
    void setFilterNeedsOneMatch() {
        assertThat(matches("labels IN (frontend, p1)")).isTrue();
        assertThat(matches("status IN (\"To Do\", Done)")).isFalse();
    }

    @Test
    void allClausesMustHold() {
        assertThat(matches("project = DEV AND labels = backend")).isTrue();
        assertThat(matches("project = DEV AND labels = infra")).isFalse();
    }

    @Test
    void currentUserResolvesAgainstPrincipal() {
        QueryPlan plan = QueryParser.parse("assignee = currentUser()");

        assertThat(evaluator.matches(plan, item, "ALICE-ID")).isTrue();
        assertThat(evaluator.matches(plan, item, "bob-id")).isFalse();
        assertThat(evaluator.matches(plan, item, null)).isFalse();
    }

    @Test
    void emptyFieldMatchesEmptyMarkers() {
        assertThat(matches("reporter = EMPTY")).isTrue();
        assertThat(matches("reporter IN (null, alice-id)")).isTrue();
        assertThat(matches("assignee = unassigned")).isFalse();
    }

    @Test
    void dateFiltersUseTheClock() {
        assertThat(matches("created >= \"2024-04-28\"")).isTrue();
        assertThat(matches("created > -2d")).isFalse();
        assertThat(matches("updated > -2d")).isTrue();
        assertThat(matches("updated <= now()")).isTrue();
    }

    @Test
    void offsetsBeyondTheInstantRangeSaturate() {
        assertThat(matches("created >= -999999999999d")).isTrue();
        assertThat(matches("created > 999999999999d")).isFalse();
        assertThat(DateLiteral.parse("-999999999999d").resolve(MutableClock.at("2024-05-01T10:00:00Z")))
                .isEqualTo(Instant.MIN);
    }

    private boolean matches(String query) {
        return evaluator.matches(QueryParser.parse(query), item, "alice-id");
    }
}
