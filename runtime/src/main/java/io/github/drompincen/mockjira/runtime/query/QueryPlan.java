package io.github.drompincen.mockjira.runtime.query;

import java.util.List;

/**
 * Structured form of a query: conjunctive filters plus sort order. An empty plan matches everything.
 */
public record QueryPlan(
        List<EqualityFilter> equalityFilters,
        List<SetFilter> setFilters,
        List<DateFilter> dateFilters,
        List<SortKey> sortKeys
) {

    public static final QueryPlan EMPTY = new QueryPlan(List.of(), List.of(), List.of(), List.of());

    public QueryPlan {
        equalityFilters = List.copyOf(equalityFilters);
        setFilters = List.copyOf(setFilters);
        dateFilters = List.copyOf(dateFilters);
        sortKeys = List.copyOf(sortKeys);
    }

    public boolean hasFilters() {
        return !equalityFilters.isEmpty() || !setFilters.isEmpty() || !dateFilters.isEmpty();
    }
}
