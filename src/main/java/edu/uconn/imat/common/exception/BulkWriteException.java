package edu.uconn.imat.common.exception;

import edu.uconn.imat.common.errorcode.LoadErrorCode;

/**
 * A COPY or DELETE failed at the store. The whole batch is lost; callers
 * recover by re-running the partition.
 */
public class BulkWriteException extends AbstractLoadException {

    public BulkWriteException(String message, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause, LoadErrorCode.BULK_WRITE);
    }
}
