package io.github.drompincen.mockjira.runtime.webhook;

import java.time.Duration;

/**
 * Tunables of webhook delivery.
 *
 * @param poisonRate probability in [0, 1] that a delivery is deliberately dropped or corrupted
 * @param logCapacity delivery records and attempts kept for inspection; the oldest are evicted first
 * @param randomSeed seed for jitter and poison rolls; 0 means non-deterministic
 */
public record WebhookSettings(
        String secret,
        String signatureVersion,
        boolean legacySignature,
        Duration jitterMin,
        Duration jitterMax,
        double poisonRate,
        Duration sendTimeout,
        int queueCapacity,
        int logCapacity,
        long randomSeed
) {

    public static WebhookSettings defaults() {
        return new WebhookSettings("mock-webhook-secret", "2", true, Duration.ofMillis(50), Duration.ofMillis(250),
                0.0, Duration.ofMillis(500), 1000, 5000, 0L);
    }
}
