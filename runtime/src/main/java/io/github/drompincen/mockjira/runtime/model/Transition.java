package io.github.drompincen.mockjira.runtime.model;

/**
 * A workflow edge. Only offered for items whose current status is {@code fromStatusId}.
 */
public record Transition(String id, String name, String fromStatusId, String toStatusId) {}
