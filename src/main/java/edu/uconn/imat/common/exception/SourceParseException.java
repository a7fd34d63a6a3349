package edu.uconn.imat.common.exception;

import edu.uconn.imat.common.errorcode.LoadErrorCode;
import lombok.Getter;

/**
 * Malformed JSON document or unreadable spreadsheet.
 */
@Getter
public class SourceParseException extends AbstractLoadException {

    /**
     * Byte offset of the failure in the source, or -1 when unknown
     */
    private final long byteOffset;

    public SourceParseException(String message, Throwable cause) {
        this(message, -1L, cause);
    }

    public SourceParseException(String message, long byteOffset, Throwable cause) {
        super(byteOffset >= 0 ? message + " (at byte " + byteOffset + ")" : message,
            cause, LoadErrorCode.SOURCE_PARSE);
        this.byteOffset = byteOffset;
    }
}
