package io.github.drompincen.mockjira.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.mockjira.gateway.config.JacksonConfig;
import io.github.drompincen.mockjira.protocol.api.IssueRequest;
import io.github.drompincen.mockjira.protocol.api.TransitionRequest;
import io.github.drompincen.mockjira.runtime.auth.AuthenticatedPrincipal;
import io.github.drompincen.mockjira.runtime.error.ValidationException;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IssueControllerTest {

    private static final AuthenticatedPrincipal ALICE = new AuthenticatedPrincipal("mock-token", "acc-alice", false);

    @Mock private InMemoryStore store;

    private final ObjectMapper mapper = JacksonConfig.mockJiraMapper();
    private IssueController controller;

    @BeforeEach
    void setUp() {
        controller = new IssueController(store, mapper);
        ObjectNode rendered = mapper.createObjectNode().put("key", "DEV-4");
        when(store.renderIssue(any())).thenReturn(rendered);
    }

    private IssueRequest request(String json) throws Exception {
        return new IssueRequest((ObjectNode) mapper.readTree(json));
    }

    @Test
    @SuppressWarnings("unchecked")
    void createPassesReferencesAndKeepsOtherFieldsAsExtras() throws Exception {
        IssueRequest request = request("""
                {"project": {"key": "DEV"}, "issuetype": {"name": "Bug"}, "summary": "Broken login",
                 "description": "steps", "labels": ["auth"], "customfield_10100": 3}
                """);

        ResponseEntity<ObjectNode> response = controller.create(ALICE, request);

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody().get("key").asText()).isEqualTo("DEV-4");
        ArgumentCaptor<Map<String, JsonNode>> extras = ArgumentCaptor.forClass(Map.class);
        verify(store).createWorkItem(eq("DEV"), eq("Bug"), eq("Broken login"), any(JsonNode.class),
                eq("acc-alice"), extras.capture());
        assertThat(extras.getValue()).containsOnlyKeys("labels", "customfield_10100");
    }

    @Test
    void createUsesExplicitReporter() throws Exception {
        controller.create(ALICE, request("""
                {"project": {"id": "10000"}, "summary": "x", "reporter": {"accountId": "acc-bob"}}
                """));

        verify(store).createWorkItem(eq("10000"), isNull(), eq("x"), isNull(), eq("acc-bob"), anyMap());
    }

    @Test
    void createWithoutFieldsIsRejected() {
        assertThatThrownBy(() -> controller.create(ALICE, new IssueRequest(null)))
                .isInstanceOf(ValidationException.class);
        verify(store, never()).createWorkItem(any(), any(), any(), any(), any(), any());
    }

    @Test
    void updateForwardsEveryField() throws Exception {
        ResponseEntity<ObjectNode> response = controller.update(ALICE, "DEV-1",
                request("{\"summary\": \"Renamed\", \"assignee\": null}"));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        verify(store).updateWorkItem(eq("DEV-1"), argThat(m -> m.containsKey("summary") && m.containsKey("assignee")),
                eq("acc-alice"));
    }

    @Test
    void transitionsAreWrapped() {
        when(store.listTransitions("DEV-1")).thenReturn(List.of(mapper.createObjectNode().put("id", "21")));

        ResponseEntity<ObjectNode> response = controller.transitions("DEV-1");

        assertThat(response.getBody().get("transitions")).hasSize(1);
        assertThat(response.getBody().get("transitions").get(0).get("id").asText()).isEqualTo("21");
    }

    @Test
    void transitionWithoutIdIsRejected() {
        assertThatThrownBy(() -> controller.transition(ALICE, "DEV-1", new TransitionRequest(null)))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getFieldErrors()).containsKey("transition.id"));
        verify(store, never()).applyTransition(anyString(), anyString(), anyString());
    }

    @Test
    void transitionReturnsTheMovedIssue() {
        ResponseEntity<ObjectNode> response = controller.transition(ALICE, "DEV-1",
                new TransitionRequest(new TransitionRequest.TransitionRef("21")));

        verify(store).applyTransition("DEV-1", "21", "acc-alice");
        assertThat(response.getBody().get("issue").get("key").asText()).isEqualTo("DEV-4");
    }

    @Test
    void commentsArePagedAndMirroredUnderComments() {
        List<ObjectNode> comments = List.of(
                mapper.createObjectNode().put("id", "20000"),
                mapper.createObjectNode().put("id", "20001"),
                mapper.createObjectNode().put("id", "20002"));
        when(store.listComments("DEV-1")).thenReturn(comments);

        ObjectNode body = controller.comments("DEV-1", 1, 1).getBody();

        assertThat(body.get("total").asInt()).isEqualTo(3);
        assertThat(body.get("startAt").asInt()).isEqualTo(1);
        assertThat(body.get("isLast").asBoolean()).isFalse();
        assertThat(body.get("comments")).hasSize(1);
        assertThat(body.get("comments").get(0).get("id").asText()).isEqualTo("20001");
        assertThat(body.get("values")).isEqualTo(body.get("comments"));
    }
}
