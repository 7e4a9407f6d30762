package io.github.drompincen.mockjira.protocol.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Helpers for the rich-text document tree used by descriptions and comment bodies.
 */
public final class Documents {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Documents() {
    }

    public static ObjectNode empty() {
        ObjectNode doc = NODES.objectNode();
        doc.put("type", "doc");
        doc.put("version", 1);
        doc.putArray("content");
        return doc;
    }

    /**
     * Wraps plain text into a document, one paragraph per blank-line separated block.
     */
    public static ObjectNode fromText(String text) {
        ObjectNode doc = empty();
        if (text == null || text.isBlank()) {
            return doc;
        }
        ArrayNode content = (ArrayNode) doc.get("content");
        for (String block : text.strip().split("\\R\\s*\\R")) {
            ObjectNode paragraph = content.addObject();
            paragraph.put("type", "paragraph");
            ObjectNode textNode = paragraph.putArray("content").addObject();
            textNode.put("type", "text");
            textNode.put("text", block.strip());
        }
        return doc;
    }

    /**
     * Returns a canonical document for {@code value}: null and blank text give the empty document,
     * text is wrapped, an existing document is deep-copied.
     *
     * @throws IllegalArgumentException for any other JSON shape
     */
    public static ObjectNode normalize(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return empty();
        }
        if (value.isTextual()) {
            return fromText(value.asText());
        }
        if (value.isObject() && "doc".equals(value.path("type").asText())) {
            ObjectNode copy = ((ObjectNode) value).deepCopy();
            if (!copy.has("version")) {
                copy.put("version", 1);
            }
            if (!copy.has("content")) {
                copy.putArray("content");
            }
            return copy;
        }
        throw new IllegalArgumentException("Unsupported document payload");
    }

    public static boolean isBlank(JsonNode doc) {
        if (doc == null || doc.isNull()) {
            return true;
        }
        return plainText(doc).isBlank();
    }

    /**
     * Concatenates the text leaves of a document.
     */
    public static String plainText(JsonNode node) {
        StringBuilder sb = new StringBuilder();
        collectText(node, sb);
        return sb.toString().strip();
    }

    private static void collectText(JsonNode node, StringBuilder sb) {
        if (node == null) {
            return;
        }
        if (node.has("text")) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(node.get("text").asText());
        }
        JsonNode content = node.get("content");
        if (content != null && content.isArray()) {
            content.forEach(child -> collectText(child, sb));
        }
    }
}
