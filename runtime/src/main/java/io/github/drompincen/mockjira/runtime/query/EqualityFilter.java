package io.github.drompincen.mockjira.runtime.query;

public record EqualityFilter(String field, QueryValue value) {}
