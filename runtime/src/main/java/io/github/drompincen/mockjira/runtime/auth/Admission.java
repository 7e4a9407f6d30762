package io.github.drompincen.mockjira.runtime.auth;

/**
 * An admitted call: who made it and how much quota is left in the current window.
 */
public record Admission(AuthenticatedPrincipal principal, int limit, int remaining, long resetEpochSeconds) {}
