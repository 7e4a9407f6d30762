package io.github.drompincen.mockjira.runtime.error;

import java.util.Map;

public class NotFoundException extends MockJiraException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message, Map.of());
    }

    public static NotFoundException of(String what, Object id) {
        return new NotFoundException(what + " " + id + " does not exist");
    }
}
