package io.github.drompincen.mockjira.runtime.auth;

import java.time.Duration;

public record RateLimitSettings(
        int limit,
        Duration window,
        int readCost,
        int writeCost,
        int searchCost,
        long forcedRetryAfterSeconds
) {

    public static RateLimitSettings defaults() {
        return new RateLimitSettings(100, Duration.ofSeconds(60), 1, 2, 5, 5);
    }

    public int costOf(OperationCost operation) {
        return switch (operation) {
            case READ -> readCost;
            case WRITE -> writeCost;
            case SEARCH -> searchCost;
        };
    }
}
