package io.github.drompincen.mockjira.runtime.model;

public record IssueLink(String id, String typeName, String inwardKey, String outwardKey) {}
