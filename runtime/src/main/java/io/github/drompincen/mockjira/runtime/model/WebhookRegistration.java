package io.github.drompincen.mockjira.runtime.model;

import java.time.Instant;
import java.util.List;

/**
 * @param events    wire names of subscribed event types
 * @param jqlFilter optional filter, validated when the webhook is registered
 * @param createdBy account that registered the webhook; {@code currentUser()} in the filter resolves to it
 */
public record WebhookRegistration(
        String id,
        String url,
        List<String> events,
        String jqlFilter,
        String createdBy,
        Instant createdAt
) {

    public WebhookRegistration {
        events = events != null ? List.copyOf(events) : List.of();
    }
}
