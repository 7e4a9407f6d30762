package io.github.drompincen.mockjira.runtime.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record Project(String id, String key, String name, ProjectType type, String leadAccountId) {

    @JsonIgnore
    public boolean isServiceDesk() {
        return type == ProjectType.SERVICE_DESK;
    }
}
