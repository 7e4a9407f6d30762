package io.github.drompincen.mockjira.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Search results. Issues are carried under both {@code issues} and {@code values} so clients written
 * against either the search or the generic page envelope can read them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResponse(
        int startAt,
        int maxResults,
        int total,
        @JsonProperty("isLast") boolean isLast,
        List<JsonNode> issues,
        List<JsonNode> values,
        List<String> warningMessages
) {

    public static SearchResponse from(PageResponse<JsonNode> page, List<String> warnings) {
        return new SearchResponse(page.startAt(), page.maxResults(), page.total(), page.isLast(),
                page.values(), page.values(), warnings.isEmpty() ? null : warnings);
    }
}
