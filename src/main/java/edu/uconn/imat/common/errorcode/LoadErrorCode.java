package edu.uconn.imat.common.errorcode;

/**
 * Error codes raised by the loader.
 *
 * Code ranges:
 * - A0xxx: problems with the input files
 * - B0xxx: problems at the target store or in the job itself
 */
public enum LoadErrorCode implements IErrorCode {

    /**
     * A required input file does not exist
     */
    MISSING_FILE("A0001", "Required input file not found"),

    /**
     * Input document or workbook could not be parsed
     */
    SOURCE_PARSE("A0002", "Input could not be parsed"),

    /**
     * A record lacks a required field or carries an uncoercible value
     */
    MALFORMED_RECORD("A0003", "Malformed input record"),

    /**
     * COPY or DELETE failed at the store
     */
    BULK_WRITE("B0001", "Write to the target store failed"),

    /**
     * The load job did not complete
     */
    JOB_FAILED("B0002", "Load job failed");

    private final String code;

    private final String message;

    LoadErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String code() {
        return code;
    }

    @Override
    public String message() {
        return message;
    }
}
