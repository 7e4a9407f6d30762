package io.github.drompincen.mockjira.runtime.error;

import java.util.Map;

public class RateLimitedException extends MockJiraException {

    private final long retryAfterSeconds;
    private final int remaining;
    private final long resetEpochSeconds;

    public RateLimitedException(String message, long retryAfterSeconds, int remaining, long resetEpochSeconds) {
        super(ErrorKind.RATE_LIMITED, message, Map.of());
        this.retryAfterSeconds = retryAfterSeconds;
        this.remaining = remaining;
        this.resetEpochSeconds = resetEpochSeconds;
        header("Retry-After", Long.toString(retryAfterSeconds));
        header("X-RateLimit-Remaining", Integer.toString(remaining));
        header("X-RateLimit-Reset", Long.toString(resetEpochSeconds));
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public int getRemaining() {
        return remaining;
    }

    public long getResetEpochSeconds() {
        return resetEpochSeconds;
    }
}
