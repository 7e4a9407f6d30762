package io.github.drompincen.mockjira.runtime.webhook;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Outcome of delivering one event to one registration.
 */
public record DeliveryRecord(
        String eventId,
        String webhookId,
        String url,
        String eventType,
        DeliveryOutcome outcome,
        boolean poisoned,
        String poisonMode,
        Instant emittedAt,
        Instant completedAt,
        JsonNode payload
) {}
