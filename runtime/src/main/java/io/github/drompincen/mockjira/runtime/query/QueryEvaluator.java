package io.github.drompincen.mockjira.runtime.query;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Applies the filters of a {@link QueryPlan} to an {@link AttributeSet}.
 */
public final class QueryEvaluator {

    private static final Set<String> EMPTY_MARKERS = Set.of("empty", "null", "unassigned");

    private final Clock clock;

    public QueryEvaluator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param principalId account {@code currentUser()} resolves to; may be null, in which case it matches nothing
     */
    public boolean matches(QueryPlan plan, AttributeSet attributes, String principalId) {
        for (EqualityFilter filter : plan.equalityFilters()) {
            if (!matchesValue(attributes.get(filter.field()), filter.value(), principalId)) {
                return false;
            }
        }
        for (SetFilter filter : plan.setFilters()) {
            List<String> actual = attributes.get(filter.field());
            boolean any = filter.values().stream().anyMatch(v -> matchesValue(actual, v, principalId));
            if (!any) {
                return false;
            }
        }
        for (DateFilter filter : plan.dateFilters()) {
            Instant actual = attributes.timestamp(filter.field());
            if (actual == null || !filter.operator().test(actual, filter.value().resolve(clock))) {
                return false;
            }
        }
        return true;
    }

    private boolean matchesValue(List<String> actual, QueryValue expected, String principalId) {
        if (expected.currentUser()) {
            return principalId != null && actual.contains(principalId.toLowerCase(Locale.ROOT));
        }
        String text = expected.text().toLowerCase(Locale.ROOT);
        if (actual.isEmpty()) {
            return EMPTY_MARKERS.contains(text);
        }
        return actual.contains(text);
    }
}
