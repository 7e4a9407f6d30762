package io.github.drompincen.mockjira.runtime.query;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Flattened, lower-cased view of an item that filters are evaluated against. Each field maps to
 * every spelling that should match it (id, key, name, email and so on); an empty list means the
 * field has no value.
 */
public record AttributeSet(Map<String, List<String>> values, Instant created, Instant updated) {

    public AttributeSet {
        values = Map.copyOf(values);
    }

    public List<String> get(String field) {
        return values.getOrDefault(field, List.of());
    }

    public Instant timestamp(String field) {
        return "updated".equals(field) ? updated : created;
    }
}
