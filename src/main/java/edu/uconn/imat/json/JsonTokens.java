package edu.uconn.imat.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.io.JsonEOFException;
import edu.uconn.imat.common.exception.SourceParseException;

import java.io.IOException;

/**
 * Token-level helpers shared by the streaming readers.
 */
final class JsonTokens {

    private JsonTokens() {
    }

    /**
     * Moves through the fields of the object the parser is inside until it is
     * on {@code name}'s FIELD_NAME token, skipping other values without
     * building them. Returns false, positioned on END_OBJECT, when the field
     * is not present.
     */
    static boolean advanceToField(JsonParser parser, String name) throws IOException {
        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_OBJECT) {
                return false;
            }
            if (token == null) {
                throw new JsonEOFException(parser, null, "Unexpected end of input inside object");
            }
            if (name.equals(parser.getCurrentName())) {
                return true;
            }
            parser.nextToken();
            parser.skipChildren();
        }
    }

    /**
     * Skips whatever is left of the top-level value, from any depth, and
     * requires the input to end right after it. A truncated document fails
     * inside Jackson; trailing content fails here.
     */
    static void finishDocument(JsonParser parser, String source) throws IOException {
        while (!parser.getParsingContext().inRoot()) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new JsonEOFException(parser, null, "Unexpected end of input");
            }
            if (token.isStructStart()) {
                parser.skipChildren();
            }
        }
        if (parser.nextToken() != null) {
            throw new SourceParseException("Unexpected content after the top-level value of " + source,
                parser.getTokenLocation().getByteOffset(), null);
        }
    }
}
