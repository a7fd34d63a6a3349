package edu.uconn.imat.copy;

import com.opencsv.CSVWriter;

import java.io.StringWriter;
import java.io.Writer;
import java.util.List;

/**
 * Encodes rows as lines of PostgreSQL's COPY CSV format with opencsv.
 *
 * <p>A {@code null} value becomes an unquoted empty field, which COPY reads as
 * NULL. An empty string is written as {@code ""} so it stays an empty string.
 * Fields containing a delimiter, a quote or a line break are quoted with
 * embedded quotes doubled, so they round-trip exactly.
 */
public class CsvRowEncoder {

    static final char DELIMITER = ',';

    static final char QUOTE = '"';

    static final String LINE_END = "\n";

    /**
     * Encodes one row, terminated by a newline.
     */
    public String encode(List<?> values) {
        String[] fields = new String[values.size()];
        for (int i = 0; i < fields.length; i++) {
            Object value = values.get(i);
            fields[i] = value == null ? null : value.toString();
        }
        StringWriter line = new StringWriter(64);
        new CopyCsvWriter(line).writeNext(fields, false);
        return line.toString();
    }

    /**
     * opencsv quotes a field only when it holds a special character. COPY
     * also needs the empty string and the {@code \.} end-of-data marker quoted.
     */
    private static final class CopyCsvWriter extends CSVWriter {

        CopyCsvWriter(Writer writer) {
            // the quote doubles as escape character, as COPY expects
            super(writer, DELIMITER, QUOTE, QUOTE, LINE_END);
        }

        @Override
        protected boolean stringContainsSpecialCharacters(String field) {
            return field.isEmpty() || field.equals("\\.") || super.stringContainsSpecialCharacters(field);
        }
    }
}
