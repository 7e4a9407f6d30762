package io.github.drompincen.mockjira.runtime.query;

public class QuerySyntaxException extends RuntimeException {

    private final int position;

    public QuerySyntaxException(String message, int position) {
        super(position >= 0 ? message + " (at position " + position + ")" : message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
