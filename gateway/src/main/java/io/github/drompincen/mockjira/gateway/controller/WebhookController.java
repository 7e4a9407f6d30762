package io.github.drompincen.mockjira.gateway.controller;

import io.github.drompincen.mockjira.gateway.web.AuthGateInterceptor;
import io.github.drompincen.mockjira.protocol.api.PageResponse;
import io.github.drompincen.mockjira.protocol.api.WebhookDto;
import io.github.drompincen.mockjira.protocol.api.WebhookRegistrationRequest;
import io.github.drompincen.mockjira.protocol.api.WebhookRegistrationResponse;
import io.github.drompincen.mockjira.runtime.auth.AuthenticatedPrincipal;
import io.github.drompincen.mockjira.runtime.error.ValidationException;
import io.github.drompincen.mockjira.runtime.model.WebhookRegistration;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import io.github.drompincen.mockjira.runtime.store.WebhookSpec;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/rest/api/3/webhook")
public class WebhookController {

    private final InMemoryStore store;

    public WebhookController(InMemoryStore store) {
        this.store = store;
    }

    /**
     * Registers every webhook of the batch or none. A webhook without its own url uses the
     * top-level one.
     */
    @PostMapping
    public ResponseEntity<WebhookRegistrationResponse> register(
            @RequestAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @RequestBody WebhookRegistrationRequest request) {
        if (request.webhooks() == null || request.webhooks().isEmpty()) {
            throw ValidationException.field("webhooks", "At least one webhook is required");
        }
        List<WebhookSpec> specs = request.webhooks().stream()
                .map(w -> new WebhookSpec(w.url() != null ? w.url() : request.url(), w.events(), w.filter()))
                .toList();
        List<WebhookRegistrationResponse.Result> results = store.registerWebhooks(specs, principal.accountId())
                .stream()
                .map(r -> new WebhookRegistrationResponse.Result(r.id(), List.of()))
                .toList();
        return ResponseEntity.status(HttpStatus.CREATED).body(new WebhookRegistrationResponse(results));
    }

    @GetMapping
    public ResponseEntity<PageResponse<WebhookDto>> list(@RequestParam(defaultValue = "0") int startAt,
                                                         @RequestParam(defaultValue = "50") int maxResults) {
        List<WebhookDto> webhooks = store.listWebhooks().stream().map(WebhookController::toDto).toList();
        return ResponseEntity.ok(PageResponse.of(webhooks, startAt, maxResults));
    }

    @DeleteMapping("/{webhookId}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String webhookId) {
        store.deleteWebhook(webhookId);
        return ResponseEntity.ok(Map.of("status", "deleted"));
    }

    static WebhookDto toDto(WebhookRegistration registration) {
        return new WebhookDto(registration.id(), registration.url(), registration.events(),
                registration.jqlFilter(), registration.createdBy(), registration.createdAt());
    }
}
