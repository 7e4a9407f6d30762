package io.github.drompincen.mockjira.protocol.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void nullBecomesEmptyDocument() {
        ObjectNode doc = Documents.normalize(null);

        assertThat(doc.get("type").asText()).isEqualTo("doc");
        assertThat(doc.get("version").asInt()).isEqualTo(1);
        assertThat(doc.get("content")).isEmpty();
        assertThat(Documents.normalize(NullNode.getInstance())).isEqualTo(Documents.empty());
    }

    @Test
    void textIsWrappedIntoParagraphs() {
        ObjectNode doc = Documents.normalize(TextNode.valueOf("First line\n\nSecond block"));

        assertThat(doc.get("content")).hasSize(2);
        assertThat(doc.at("/content/0/content/0/text").asText()).isEqualTo("First line");
        assertThat(Documents.plainText(doc)).isEqualTo("First line Second block");
    }

    @Test
    void existingDocumentIsCopied() throws Exception {
        JsonNode input = mapper.readTree("""
                {"type":"doc","version":1,"content":[{"type":"paragraph","content":[{"type":"text","text":"hi"}]}]}
                """);

        ObjectNode doc = Documents.normalize(input);
        ((ObjectNode) input).put("version", 2);

        assertThat(doc.get("version").asInt()).isEqualTo(1);
        assertThat(Documents.plainText(doc)).isEqualTo("hi");
    }

    @Test
    void otherShapesAreRejected() {
        assertThatThrownBy(() -> Documents.normalize(mapper.createArrayNode()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Documents.normalize(mapper.createObjectNode().put("type", "paragraph")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankDetection() {
        assertThat(Documents.isBlank(Documents.empty())).isTrue();
        assertThat(Documents.isBlank(Documents.fromText("   "))).isTrue();
        assertThat(Documents.isBlank(Documents.fromText("x"))).isFalse();
    }
}
