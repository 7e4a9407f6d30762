package io.github.drompincen.mockjira.runtime.error;

import java.util.Map;

public class ValidationException extends MockJiraException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message, Map.of());
    }

    public ValidationException(String message, Map<String, String> fieldErrors) {
        super(ErrorKind.VALIDATION, message, fieldErrors);
    }

    public static ValidationException field(String field, String message) {
        return new ValidationException(message, Map.of(field, message));
    }
}
