package edu.uconn.imat.json;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Coercions applied to raw element fields.
 */
public final class JsonValues {

    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+");

    private JsonValues() {
    }

    /**
     * Integer value of {@code node}: integral numbers, floating numbers with
     * no fractional part, and text holding an optionally signed run of digits.
     * Empty for anything else, including values outside the long range.
     */
    public static OptionalLong asLong(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return OptionalLong.empty();
        }
        if (node.isNumber()) {
            try {
                return OptionalLong.of(node.decimalValue().longValueExact());
            } catch (ArithmeticException | NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        if (node.isTextual()) {
            String text = node.textValue().trim();
            if (!INTEGER_TEXT.matcher(text).matches()) {
                return OptionalLong.empty();
            }
            try {
                return OptionalLong.of(Long.parseLong(text));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    /**
     * Text of a non-null scalar; empty for null, missing, objects and arrays.
     */
    public static Optional<String> asText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }
}
