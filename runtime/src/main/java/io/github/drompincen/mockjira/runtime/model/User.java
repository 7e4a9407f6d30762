package io.github.drompincen.mockjira.runtime.model;

public record User(String accountId, String displayName, String email, String timeZone) {}
