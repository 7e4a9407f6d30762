package io.github.drompincen.mockjira.runtime.webhook;

import java.time.Instant;

public record DeliveryAttempt(
        String eventId,
        String webhookId,
        String url,
        Integer statusCode,
        String error,
        long latencyMs,
        long jitterMs,
        boolean poisoned,
        Instant timestamp
) {}
