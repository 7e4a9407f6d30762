package io.github.drompincen.mockjira.runtime.error;

import java.util.Map;

public class ForbiddenException extends MockJiraException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message, Map.of());
    }
}
