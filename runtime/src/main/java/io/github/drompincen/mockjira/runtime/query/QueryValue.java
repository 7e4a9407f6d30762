package io.github.drompincen.mockjira.runtime.query;

/**
 * A filter operand. {@code currentUser()} is kept as an unresolved placeholder until evaluation.
 */
public record QueryValue(String text, boolean currentUser) {

    public static QueryValue literal(String text) {
        return new QueryValue(text, false);
    }

    public static QueryValue currentUserPlaceholder() {
        return new QueryValue("currentUser()", true);
    }
}
