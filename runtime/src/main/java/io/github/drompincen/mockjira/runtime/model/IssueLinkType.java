package io.github.drompincen.mockjira.runtime.model;

public record IssueLinkType(String id, String name, String inward, String outward) {}
