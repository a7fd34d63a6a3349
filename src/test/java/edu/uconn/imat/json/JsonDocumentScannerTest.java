package edu.uconn.imat.json;

import com.fasterxml.jackson.databind.JsonNode;
import edu.uconn.imat.common.exception.SourceParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonDocumentScanner Unit Tests")
class JsonDocumentScannerTest {

    private static final Set<String> FIELDS = Set.of("info", "license");

    @Test
    @DisplayName("Should read requested fields around large arrays")
    void shouldReadRequestedFields() {
        String json = "{\"images\":[{\"imageId\":\"1\"},{\"imageId\":\"2\"}],"
            + "\"info\":{\"year\":2020},\"annotations\":[],\"license\":{\"name\":\"CC\"}}";

        Map<String, JsonNode> fields = scan(json);

        assertThat(fields).containsOnlyKeys("info", "license");
        assertThat(fields.get("info").get("year").asInt()).isEqualTo(2020);
        assertThat(fields.get("license").get("name").asText()).isEqualTo("CC");
    }

    @Test
    @DisplayName("Should return nothing when the fields are absent")
    void shouldReturnNothingForAbsentFields() {
        assertThat(scan("{\"images\":[],\"annotations\":[]}")).isEmpty();
    }

    @Test
    @DisplayName("Should treat null values as absent")
    void shouldTreatNullAsAbsent() {
        Map<String, JsonNode> fields = scan("{\"info\":null,\"license\":{\"name\":\"CC\"}}");

        assertThat(fields).containsOnlyKeys("license");
    }

    @Test
    @DisplayName("Should keep the first occurrence of a repeated field")
    void shouldKeepFirstOccurrence() {
        Map<String, JsonNode> fields = scan("{\"info\":{\"v\":1},\"info\":{\"v\":2}}");

        assertThat(fields.get("info").get("v").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a document cut off after the requested fields")
    void shouldRejectTruncatedDocument() {
        // Given - info and license are complete, the root object is never closed
        String json = "{\"info\":{\"v\":1},\"license\":{\"v\":2},\"images\":[{\"imageId\":\"1\"}]";

        // When / Then
        assertThatThrownBy(() -> scan(json))
            .isInstanceOfSatisfying(SourceParseException.class,
                e -> assertThat(e.getMessage()).contains("test.json"));
    }

    @Test
    @DisplayName("Should reject garbage inside the document after the requested fields")
    void shouldRejectGarbageAfterFields() {
        String json = "{\"info\":{\"v\":1},\"license\":{\"v\":2},\"images\":[ ##### ]}";

        assertThatThrownBy(() -> scan(json)).isInstanceOf(SourceParseException.class);
    }

    @Test
    @DisplayName("Should reject content after the root object")
    void shouldRejectTrailingContent() {
        // Given
        String json = "{\"info\":{\"v\":1},\"images\":[]} ]]] not json";

        // When / Then
        assertThatThrownBy(() -> scan(json))
            .isInstanceOfSatisfying(SourceParseException.class,
                e -> assertThat(e.getByteOffset()).isGreaterThanOrEqualTo(json.indexOf("]]]")));
    }

    @Test
    @DisplayName("Should reject a second top-level value")
    void shouldRejectSecondRootValue() {
        assertThatThrownBy(() -> scan("{\"info\":{}} {\"info\":{}}"))
            .isInstanceOf(SourceParseException.class)
            .hasMessageContaining("after the top-level value");
    }

    @Test
    @DisplayName("Should reject a document whose root is not an object")
    void shouldRejectNonObjectRoot() {
        assertThatThrownBy(() -> scan("[1,2,3]")).isInstanceOf(SourceParseException.class);
    }

    @Test
    @DisplayName("Should report malformed JSON with its byte offset")
    void shouldReportMalformedJson() {
        assertThatThrownBy(() -> scan("{\"images\":[1,,2],\"info\":{}}"))
            .isInstanceOfSatisfying(SourceParseException.class,
                e -> assertThat(e.getByteOffset()).isGreaterThan(0L));
    }

    private Map<String, JsonNode> scan(String json) {
        return JsonDocumentScanner.readTopLevelFields(
            new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), FIELDS, "test.json");
    }
}
