package io.github.drompincen.mockjira.runtime.model;

public record IssueType(String id, String name, boolean subtask) {}
