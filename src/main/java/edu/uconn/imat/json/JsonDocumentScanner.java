package edu.uconn.imat.json;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.io.JsonEOFException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.uconn.imat.common.exception.MissingFileException;
import edu.uconn.imat.common.exception.SourceParseException;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads selected top-level fields of a JSON document as trees while skipping
 * all other top-level values, so large sibling arrays are never materialized.
 */
public final class JsonDocumentScanner {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonDocumentScanner() {
    }

    public static Map<String, JsonNode> readTopLevelFields(Path file, Set<String> names) {
        MissingFileException.requireFile(file);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            return readTopLevelFields(in, names, file.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + file, e);
        }
    }

    /**
     * Returns the requested fields that are present with a non-null value, in
     * document order. The first occurrence of a repeated field wins. The whole
     * document is read, so a truncated document or content after the root
     * object is a {@link SourceParseException} even when every requested
     * field came before the damage.
     */
    public static Map<String, JsonNode> readTopLevelFields(InputStream in, Set<String> names, String source) {
        Map<String, JsonNode> found = new LinkedHashMap<>();
        try (JsonParser parser = MAPPER.getFactory().createParser(in)) {
            JsonToken root = parser.nextToken();
            if (root == null) {
                throw new SourceParseException("Empty JSON document " + source, 0L, null);
            }
            if (root != JsonToken.START_OBJECT) {
                throw new SourceParseException("Top-level JSON value of " + source + " is not an object",
                    parser.getTokenLocation().getByteOffset(), null);
            }
            Set<String> seen = new HashSet<>();
            while (true) {
                JsonToken token = parser.nextToken();
                if (token == JsonToken.END_OBJECT) {
                    break;
                }
                if (token == null) {
                    throw new JsonEOFException(parser, null, "Unexpected end of input inside object");
                }
                String field = parser.getCurrentName();
                parser.nextToken();
                if (names.contains(field) && seen.add(field)) {
                    JsonNode value = parser.readValueAsTree();
                    if (value != null && !value.isNull()) {
                        found.put(field, value);
                    }
                } else {
                    parser.skipChildren();
                }
            }
            JsonTokens.finishDocument(parser, source);
            return found;
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            throw new SourceParseException("Malformed JSON in " + source + ": " + e.getOriginalMessage(),
                location == null ? -1L : location.getByteOffset(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + source, e);
        }
    }
}
