package io.github.drompincen.mockjira.runtime.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChangeItem(
        String field,
        String from,
        @JsonProperty("fromString") String fromDisplay,
        String to,
        @JsonProperty("toString") String toDisplay
) {}
