package io.github.drompincen.mockjira.gateway.web;

import io.github.drompincen.mockjira.runtime.auth.Admission;
import io.github.drompincen.mockjira.runtime.auth.AuthGate;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Runs every gated request through the {@link AuthGate}. Rejections propagate as domain exceptions
 * and are rendered by {@link ApiExceptionHandler}; admitted requests carry the principal as a request
 * attribute and the remaining quota as response headers.
 */
@Component
public class AuthGateInterceptor implements HandlerInterceptor {

    public static final String PRINCIPAL_ATTRIBUTE = "mockjira.principal";
    public static final String FORCE_FAILURE_HEADER = "X-Force-429";

    private final AuthGate gate;

    public AuthGateInterceptor(AuthGate gate) {
        this.gate = gate;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        Admission admission = gate.admit(request.getHeader(HttpHeaders.AUTHORIZATION), request.getMethod(),
                request.getRequestURI(), request.getHeader(FORCE_FAILURE_HEADER));
        request.setAttribute(PRINCIPAL_ATTRIBUTE, admission.principal());
        response.setHeader("X-RateLimit-Limit", Integer.toString(admission.limit()));
        response.setHeader("X-RateLimit-Remaining", Integer.toString(admission.remaining()));
        response.setHeader("X-RateLimit-Reset", Long.toString(admission.resetEpochSeconds()));
        return true;
    }
}
