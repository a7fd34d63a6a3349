package edu.uconn.imat.common.exception;

import edu.uconn.imat.common.errorcode.LoadErrorCode;
import lombok.Getter;
import org.springframework.batch.core.BatchStatus;

/**
 * The load job ended in a status other than COMPLETED.
 */
@Getter
public class LoadJobFailedException extends AbstractLoadException {

    private final BatchStatus status;

    public LoadJobFailedException(BatchStatus status, Throwable cause) {
        super("Load job finished with status " + status, cause, LoadErrorCode.JOB_FAILED);
        this.status = status;
    }
}
