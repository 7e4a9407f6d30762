package io.github.drompincen.mockjira.runtime.auth;

import io.github.drompincen.mockjira.runtime.error.ForbiddenException;
import io.github.drompincen.mockjira.runtime.error.RateLimitedException;
import io.github.drompincen.mockjira.runtime.error.UnauthorizedException;
import io.github.drompincen.mockjira.runtime.model.AuthToken;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Front door of every gated call: bearer token validation, read-only enforcement, forced failures
 * and cost-weighted rate limiting, in that order.
 */
@Service
public class AuthGate {

    private static final Logger log = LoggerFactory.getLogger(AuthGate.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final InMemoryStore store;
    private final CostWindowRateLimiter rateLimiter;

    public AuthGate(InMemoryStore store, CostWindowRateLimiter rateLimiter) {
        this.store = store;
        this.rateLimiter = rateLimiter;
    }

    /**
     * @param authorization value of the Authorization header, may be null
     * @param forceFailure  value of the forced rate-limit header, may be null
     */
    public Admission admit(String authorization, String method, String path, String forceFailure) {
        AuthToken token = authenticate(authorization);
        AuthenticatedPrincipal principal = new AuthenticatedPrincipal(token.token(), token.accountId(),
                token.readOnly());
        OperationCost operation = OperationCost.classify(method, path);
        if (token.readOnly() && operation == OperationCost.WRITE) {
            throw new ForbiddenException("This token is read-only");
        }
        RateLimitSettings settings = rateLimiter.settings();
        if (forceFailure != null && !forceFailure.isBlank() && token.allowForcedFailures()) {
            log.debug("Forced rate limit response for {} {}", method, path);
            throw new RateLimitedException("Rate limit exceeded (forced)", settings.forcedRetryAfterSeconds(),
                    rateLimiter.remaining(token.token()), rateLimiter.resetEpochSeconds(token.token()));
        }
        int remaining = rateLimiter.admit(token.token(), settings.costOf(operation));
        return new Admission(principal, settings.limit(), remaining, rateLimiter.resetEpochSeconds(token.token()));
    }

    private AuthToken authenticate(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new UnauthorizedException("Missing bearer token");
        }
        String value = authorization.substring(BEARER_PREFIX.length()).trim();
        if (value.isEmpty()) {
            throw new UnauthorizedException("Missing bearer token");
        }
        return store.findToken(value).orElseThrow(() -> new UnauthorizedException("Invalid API token"));
    }
}
