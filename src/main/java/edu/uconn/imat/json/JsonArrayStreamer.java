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
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily yields the elements of one array inside a large JSON document.
 *
 * <p>The array is named by a dotted path of object fields from the document
 * root, for example {@code "images"} or {@code "data.images"}. Only the
 * current element is held in memory; every other value on the way is skipped
 * token by token. When the path does not exist, or does not lead to an array,
 * the sequence is empty.
 *
 * <p>Single pass: elements come out in document order and the streamer cannot
 * be rewound. Closing it closes the underlying stream. Malformed JSON surfaces
 * from {@link #hasNext()} as a {@link SourceParseException}; once the array is
 * used up the rest of the document is read through, so a truncated document
 * or trailing content fails the last {@code hasNext()} too.
 */
public class JsonArrayStreamer implements Iterator<JsonNode>, Closeable {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JsonParser parser;

    private final String[] segments;

    private final String source;

    private boolean located;

    private boolean exhausted;

    private JsonNode next;

    public JsonArrayStreamer(InputStream in, String path, String source) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Array path must not be blank");
        }
        this.segments = path.split("\\.");
        this.source = source;
        try {
            this.parser = MAPPER.getFactory().createParser(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open " + source, e);
        }
    }

    /**
     * Opens {@code file} and streams the array at {@code path}.
     */
    public static JsonArrayStreamer open(Path file, String path) {
        MissingFileException.requireFile(file);
        try {
            return new JsonArrayStreamer(new BufferedInputStream(Files.newInputStream(file)), path, file.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open " + file, e);
        }
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        try {
            if (!located) {
                located = true;
                if (!locateArray()) {
                    exhausted = true;
                    JsonTokens.finishDocument(parser, source);
                    return false;
                }
            }
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                exhausted = true;
                JsonTokens.finishDocument(parser, source);
                return false;
            }
            if (token == null) {
                throw new JsonEOFException(parser, null, "Unexpected end of input inside array");
            }
            next = parser.readValueAsTree();
            return true;
        } catch (JsonProcessingException e) {
            exhausted = true;
            throw parseFailure(e);
        } catch (IOException e) {
            exhausted = true;
            throw new UncheckedIOException("Failed reading " + source, e);
        }
    }

    @Override
    public JsonNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        JsonNode element = next;
        next = null;
        return element;
    }

    @Override
    public void close() {
        try {
            parser.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed closing " + source, e);
        }
    }

    /**
     * Positions the parser on the START_ARRAY of the target, or returns false
     * when the path is absent.
     */
    private boolean locateArray() throws IOException {
        JsonToken root = parser.nextToken();
        if (root == null) {
            throw new SourceParseException("Empty JSON document " + source, 0L, null);
        }
        if (root != JsonToken.START_OBJECT) {
            return false;
        }
        for (int depth = 0; depth < segments.length; depth++) {
            if (!JsonTokens.advanceToField(parser, segments[depth])) {
                return false;
            }
            JsonToken value = parser.nextToken();
            if (depth == segments.length - 1) {
                return value == JsonToken.START_ARRAY;
            }
            if (value != JsonToken.START_OBJECT) {
                return false;
            }
        }
        return false;
    }

    private SourceParseException parseFailure(JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        long offset = location == null ? -1L : location.getByteOffset();
        return new SourceParseException("Malformed JSON in " + source + ": " + e.getOriginalMessage(), offset, e);
    }
}
