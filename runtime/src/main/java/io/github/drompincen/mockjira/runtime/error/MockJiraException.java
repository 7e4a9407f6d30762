package io.github.drompincen.mockjira.runtime.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base of the domain error hierarchy. Carries everything needed to render the protocol error
 * envelope: messages, per-field errors and any response headers.
 */
public abstract class MockJiraException extends RuntimeException {

    private final ErrorKind kind;
    private final List<String> messages;
    private final Map<String, String> fieldErrors;
    private final Map<String, String> headers = new LinkedHashMap<>();

    protected MockJiraException(ErrorKind kind, String message, Map<String, String> fieldErrors) {
        super(message);
        this.kind = kind;
        this.messages = message != null ? List.of(message) : List.of();
        this.fieldErrors = fieldErrors != null ? Map.copyOf(fieldErrors) : Map.of();
    }

    public ErrorKind getKind() {
        return kind;
    }

    public List<String> getMessages() {
        return messages;
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    public Map<String, String> getHeaders() {
        return Map.copyOf(headers);
    }

    protected void header(String name, String value) {
        headers.put(name, value);
    }
}
