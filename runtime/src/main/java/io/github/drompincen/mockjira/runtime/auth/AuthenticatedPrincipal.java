package io.github.drompincen.mockjira.runtime.auth;

public record AuthenticatedPrincipal(String token, String accountId, boolean readOnly) {}
