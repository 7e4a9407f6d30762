package io.github.drompincen.mockjira.runtime.query;

public record SortKey(String field, boolean descending) {

    public static SortKey asc(String field) {
        return new SortKey(field, false);
    }

    public static SortKey desc(String field) {
        return new SortKey(field, true);
    }
}
