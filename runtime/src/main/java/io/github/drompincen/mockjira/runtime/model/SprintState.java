package io.github.drompincen.mockjira.runtime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Sprint lifecycle. States only move forward: future, active, closed.
 */
public enum SprintState {
    FUTURE,
    ACTIVE,
    CLOSED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SprintState fromWire(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown sprint state: " + value, e);
        }
    }

    public boolean canMoveTo(SprintState next) {
        return next.ordinal() == ordinal() || next.ordinal() == ordinal() + 1;
    }
}
