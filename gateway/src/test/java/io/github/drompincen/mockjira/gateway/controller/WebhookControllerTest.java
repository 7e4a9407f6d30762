package io.github.drompincen.mockjira.gateway.controller;

import io.github.drompincen.mockjira.protocol.api.PageResponse;
import io.github.drompincen.mockjira.protocol.api.WebhookDto;
import io.github.drompincen.mockjira.protocol.api.WebhookRegistrationRequest;
import io.github.drompincen.mockjira.protocol.api.WebhookRegistrationRequest.WebhookDetails;
import io.github.drompincen.mockjira.protocol.api.WebhookRegistrationResponse;
import io.github.drompincen.mockjira.runtime.auth.AuthenticatedPrincipal;
import io.github.drompincen.mockjira.runtime.error.NotFoundException;
import io.github.drompincen.mockjira.runtime.error.ValidationException;
import io.github.drompincen.mockjira.runtime.model.WebhookRegistration;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import io.github.drompincen.mockjira.runtime.store.WebhookSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WebhookControllerTest {

    private static final AuthenticatedPrincipal ALICE = new AuthenticatedPrincipal("mock-token", "acc-alice", false);
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock private InMemoryStore store;

    private WebhookController controller;

    @BeforeEach
    void setUp() {
        controller = new WebhookController(store);
        when(store.registerWebhooks(anyList(), any())).thenAnswer(inv -> {
            List<WebhookSpec> specs = inv.getArgument(0);
            List<WebhookRegistration> created = new ArrayList<>();
            for (int i = 0; i < specs.size(); i++) {
                WebhookSpec spec = specs.get(i);
                created.add(new WebhookRegistration(String.valueOf(40000 + i), spec.url(), spec.events(),
                        spec.jqlFilter(), inv.getArgument(1), NOW));
            }
            return created;
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void registerFallsBackToTopLevelUrlAndReportsIds() {
        WebhookRegistrationRequest request = new WebhookRegistrationRequest("http://hooks.test/all", List.of(
                new WebhookDetails(null, List.of("jira:issue_created"), "project = DEV", null),
                new WebhookDetails("http://hooks.test/comments", List.of("comment_created"), null, "project = SUP")));

        ResponseEntity<WebhookRegistrationResponse> response = controller.register(ALICE, request);

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody().webhookRegistrationResult())
                .extracting(WebhookRegistrationResponse.Result::createdWebhookId)
                .containsExactly("40000", "40001");
        ArgumentCaptor<List<WebhookSpec>> specs = ArgumentCaptor.forClass(List.class);
        verify(store).registerWebhooks(specs.capture(), eq("acc-alice"));
        assertThat(specs.getValue()).containsExactly(
                new WebhookSpec("http://hooks.test/all", List.of("jira:issue_created"), "project = DEV"),
                new WebhookSpec("http://hooks.test/comments", List.of("comment_created"), "project = SUP"));
    }

    @Test
    void registerWithoutWebhooksIsRejected() {
        assertThatThrownBy(() -> controller.register(ALICE, new WebhookRegistrationRequest("http://x", List.of())))
                .isInstanceOf(ValidationException.class);
        verify(store, never()).registerWebhooks(anyList(), any());
    }

    @Test
    void listIsPaged() {
        when(store.listWebhooks()).thenReturn(List.of(
                new WebhookRegistration("40000", "http://a", List.of("jira:issue_created"), null, "acc-alice", NOW),
                new WebhookRegistration("40001", "http://b", List.of("sprint_created"), null, "acc-alice", NOW)));

        PageResponse<WebhookDto> page = controller.list(0, 50).getBody();

        assertThat(page.total()).isEqualTo(2);
        assertThat(page.values()).extracting(WebhookDto::url).containsExactly("http://a", "http://b");
    }

    @Test
    void deleteReportsStatusAndPropagatesNotFound() {
        ResponseEntity<Map<String, String>> response = controller.delete("40000");
        assertThat(response.getBody()).containsEntry("status", "deleted");

        doThrow(NotFoundException.of("Webhook", "1")).when(store).deleteWebhook("1");
        assertThatThrownBy(() -> controller.delete("1")).isInstanceOf(NotFoundException.class);
    }
}
