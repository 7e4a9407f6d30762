package io.github.drompincen.mockjira.gateway.web;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads references out of request bodies, which clients send either as plain strings or as
 * objects such as {@code {"key": "DEV"}} or {@code {"accountId": "..."}}.
 */
public final class RequestFields {

    private RequestFields() {
    }

    /**
     * @return the text value of {@code node}, or of its first non-blank property among {@code keys};
     *         null when absent
     */
    public static String reference(JsonNode node, String... keys) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isValueNode()) {
            String text = node.asText();
            return text.isBlank() ? null : text;
        }
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    public static String text(JsonNode node) {
        return node == null || node.isNull() || !node.isValueNode() ? null : node.asText();
    }
}
