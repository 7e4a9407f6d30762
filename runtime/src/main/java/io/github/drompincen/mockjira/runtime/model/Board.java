package io.github.drompincen.mockjira.runtime.model;

public record Board(long id, String name, String type, String projectKey) {}
