package io.github.drompincen.mockjira.runtime.model;

public record Status(String id, String name, String categoryKey) {}
