package io.github.drompincen.mockjira.gateway.controller;

import io.github.drompincen.mockjira.protocol.api.PageResponse;
import io.github.drompincen.mockjira.runtime.webhook.DeliveryAttempt;
import io.github.drompincen.mockjira.runtime.webhook.DeliveryRecord;
import io.github.drompincen.mockjira.runtime.webhook.WebhookDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to the dispatcher's delivery and attempt logs, oldest first.
 */
@RestController
@RequestMapping("/_mock/webhooks")
public class WebhookInspectionController {

    private final WebhookDispatcher dispatcher;

    public WebhookInspectionController(WebhookDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @GetMapping("/deliveries")
    public ResponseEntity<PageResponse<DeliveryRecord>> deliveries(
            @RequestParam(defaultValue = "0") int startAt,
            @RequestParam(defaultValue = "1000") int maxResults) {
        return ResponseEntity.ok(PageResponse.of(dispatcher.deliveries(), startAt, maxResults));
    }

    @GetMapping("/logs")
    public ResponseEntity<PageResponse<DeliveryAttempt>> logs(
            @RequestParam(defaultValue = "0") int startAt,
            @RequestParam(defaultValue = "1000") int maxResults) {
        return ResponseEntity.ok(PageResponse.of(dispatcher.attempts(), startAt, maxResults));
    }
}
