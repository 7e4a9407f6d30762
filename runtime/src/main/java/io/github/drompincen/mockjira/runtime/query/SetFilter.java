package io.github.drompincen.mockjira.runtime.query;

import java.util.List;

public record SetFilter(String field, List<QueryValue> values) {

    public SetFilter {
        values = List.copyOf(values);
    }
}
