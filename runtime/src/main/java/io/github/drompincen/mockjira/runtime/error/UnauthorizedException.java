package io.github.drompincen.mockjira.runtime.error;

import java.util.Map;

public class UnauthorizedException extends MockJiraException {

    public static final String CHALLENGE = "Bearer realm=\"mockjira\"";

    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message, Map.of());
        header("WWW-Authenticate", CHALLENGE);
    }
}
