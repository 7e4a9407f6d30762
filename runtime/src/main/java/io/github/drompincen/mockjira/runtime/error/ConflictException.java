package io.github.drompincen.mockjira.runtime.error;

import java.util.Map;

public class ConflictException extends MockJiraException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message, Map.of());
    }
}
