package io.github.drompincen.mockjira.runtime.query;

public record DateFilter(String field, ComparisonOperator operator, DateLiteral value) {}
