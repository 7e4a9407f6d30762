package io.github.drompincen.mockjira.gateway.web;

import io.github.drompincen.mockjira.protocol.api.TraceEntry;
import io.github.drompincen.mockjira.runtime.auth.AuthenticatedPrincipal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Tags every request with an {@code X-Request-Id} (echoing a client-supplied one) and records it in
 * the {@link RequestTraceLog} once the response status is known.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTraceFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final Logger log = LoggerFactory.getLogger(RequestTraceFilter.class);
    private static final int MAX_REQUEST_ID_LENGTH = 128;

    private final RequestTraceLog traceLog;
    private final Clock clock;

    public RequestTraceFilter(RequestTraceLog traceLog, Clock clock) {
        this.traceLog = traceLog;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = requestIdOf(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        Instant started = clock.instant();
        long startNanos = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            Object principal = request.getAttribute(AuthGateInterceptor.PRINCIPAL_ATTRIBUTE);
            String accountId = principal instanceof AuthenticatedPrincipal p ? p.accountId() : null;
            traceLog.record(new TraceEntry(requestId, request.getMethod(), request.getRequestURI(),
                    request.getQueryString(), response.getStatus(), accountId, durationMs, started));
            log.debug("{} {} -> {} in {}ms [{}]", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), durationMs, requestId);
        }
    }

    private static String requestIdOf(HttpServletRequest request) {
        String supplied = request.getHeader(REQUEST_ID_HEADER);
        if (supplied == null || supplied.isBlank() || supplied.length() > MAX_REQUEST_ID_LENGTH) {
            return UUID.randomUUID().toString();
        }
        return supplied.trim();
    }
}
