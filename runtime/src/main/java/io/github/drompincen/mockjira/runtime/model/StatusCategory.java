package io.github.drompincen.mockjira.runtime.model;

public record StatusCategory(int id, String key, String name) {

    public static final String NEW = "new";
    public static final String IN_PROGRESS = "indeterminate";
    public static final String DONE = "done";
}
