package io.github.drompincen.mockjira.protocol.api;

import java.util.List;
import java.util.Map;

public record ErrorResponse(List<String> errorMessages, Map<String, String> errors) {

    public static ErrorResponse of(String message) {
        return new ErrorResponse(List.of(message), Map.of());
    }
}
