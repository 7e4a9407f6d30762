package io.github.drompincen.mockjira.runtime.auth;

import io.github.drompincen.mockjira.runtime.error.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cost-weighted sliding window per token. Entries older than the window are pruned lazily on each
 * admission check; the check and the record happen atomically per token.
 */
@Component
public class CostWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(CostWindowRateLimiter.class);

    private final RateLimitSettings settings;
    private final Clock clock;
    private final ConcurrentHashMap<String, Deque<WindowEntry>> windows = new ConcurrentHashMap<>();

    public CostWindowRateLimiter(RateLimitSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Records a call of {@code cost} against {@code token} or rejects it.
     *
     * @return remaining quota after recording the call
     * @throws RateLimitedException if the window total plus {@code cost} would exceed the limit
     */
    public int admit(String token, int cost) {
        Deque<WindowEntry> window = windows.computeIfAbsent(token, k -> new ArrayDeque<>());
        synchronized (window) {
            Instant now = clock.instant();
            prune(window, now);
            int used = used(window);
            if (used + cost > settings.limit()) {
                Instant oldest = window.isEmpty() ? now : window.peekFirst().timestamp();
                Instant reset = oldest.plus(settings.window());
                long retryAfter = Math.max(1, ceilSeconds(reset.toEpochMilli() - now.toEpochMilli()));
                int remaining = Math.max(0, settings.limit() - used);
                log.debug("Rejected call for token {}: used {} + cost {} > limit {}", mask(token), used, cost,
                        settings.limit());
                throw new RateLimitedException("Rate limit exceeded", retryAfter, remaining,
                        ceilSeconds(reset.toEpochMilli()));
            }
            window.addLast(new WindowEntry(now, cost));
            return settings.limit() - used - cost;
        }
    }

    /**
     * Quota left for {@code token} without recording anything.
     */
    public int remaining(String token) {
        Deque<WindowEntry> window = windows.get(token);
        if (window == null) {
            return settings.limit();
        }
        synchronized (window) {
            prune(window, clock.instant());
            return Math.max(0, settings.limit() - used(window));
        }
    }

    /**
     * Epoch second at which the oldest entry of {@code token} leaves the window.
     */
    public long resetEpochSeconds(String token) {
        Instant now = clock.instant();
        Deque<WindowEntry> window = windows.get(token);
        if (window == null) {
            return ceilSeconds(now.plus(settings.window()).toEpochMilli());
        }
        synchronized (window) {
            prune(window, now);
            Instant oldest = window.isEmpty() ? now : window.peekFirst().timestamp();
            return ceilSeconds(oldest.plus(settings.window()).toEpochMilli());
        }
    }

    public void resetWindows() {
        windows.clear();
        log.info("Cleared all rate limit windows");
    }

    public RateLimitSettings settings() {
        return settings;
    }

    private void prune(Deque<WindowEntry> window, Instant now) {
        Instant cutoff = now.minus(settings.window());
        while (!window.isEmpty() && window.peekFirst().timestamp().isBefore(cutoff)) {
            window.removeFirst();
        }
    }

    private static int used(Deque<WindowEntry> window) {
        int total = 0;
        for (WindowEntry entry : window) {
            total += entry.cost();
        }
        return total;
    }

    private static long ceilSeconds(long millis) {
        return Math.floorDiv(millis + 999, 1000);
    }

    static String mask(String token) {
        if (token == null || token.length() <= 4) {
            return "****";
        }
        return token.substring(0, 4) + "****";
    }

    private record WindowEntry(Instant timestamp, int cost) {}
}
