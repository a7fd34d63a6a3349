package edu.uconn.imat.common.exception;

import edu.uconn.imat.common.errorcode.LoadErrorCode;
import lombok.Getter;

/**
 * A streamed element or spreadsheet row is missing a required field or holds
 * a value that cannot be coerced to the column type.
 */
@Getter
public class MalformedRecordException extends AbstractLoadException {

    /**
     * Raw offending record as it appeared in the source
     */
    private final String rawRecord;

    public MalformedRecordException(String message, String rawRecord) {
        super(message + ": " + rawRecord, null, LoadErrorCode.MALFORMED_RECORD);
        this.rawRecord = rawRecord;
    }
}
