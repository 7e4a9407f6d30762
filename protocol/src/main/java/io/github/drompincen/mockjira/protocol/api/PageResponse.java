package io.github.drompincen.mockjira.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Page envelope shared by every list and search endpoint.
 */
public record PageResponse<T>(
        int startAt,
        int maxResults,
        int total,
        @JsonProperty("isLast") boolean isLast,
        List<T> values
) {

    /**
     * Slices {@code items} into a page. Negative offsets and sizes are clamped to zero and a
     * {@code maxResults} of zero yields an empty page.
     */
    public static <T> PageResponse<T> of(List<T> items, int startAt, int maxResults) {
        int start = Math.max(startAt, 0);
        int size = Math.max(maxResults, 0);
        int total = items.size();
        List<T> page;
        if (size == 0 || start >= total) {
            page = List.of();
        } else {
            page = List.copyOf(items.subList(start, start + Math.min(size, total - start)));
        }
        return new PageResponse<>(start, size, total, start + page.size() >= total, page);
    }
}
