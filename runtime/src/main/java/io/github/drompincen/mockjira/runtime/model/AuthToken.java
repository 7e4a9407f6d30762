package io.github.drompincen.mockjira.runtime.model;

/**
 * A seeded API token mapped to the account it authenticates as.
 *
 * @param readOnly            write calls made with this token are refused
 * @param allowForcedFailures the token honours the forced rate-limit request header
 */
public record AuthToken(String token, String accountId, boolean readOnly, boolean allowForcedFailures) {}
