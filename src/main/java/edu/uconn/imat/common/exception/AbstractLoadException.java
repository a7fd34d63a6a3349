package edu.uconn.imat.common.exception;

import edu.uconn.imat.common.errorcode.IErrorCode;
import lombok.Getter;

import java.util.Optional;

/**
 * Base class of every loader failure.
 * All of them are fatal: nothing in the loader retries or recovers from one.
 */
@Getter
public abstract class AbstractLoadException extends RuntimeException {

    /**
     * Error code
     */
    private final String errorCode;

    /**
     * Error message, defaulting to the error code's message
     */
    private final String errorMessage;

    protected AbstractLoadException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable);
        this.errorCode = errorCode.code();
        this.errorMessage = Optional.ofNullable(message).orElse(errorCode.message());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + "]: " + errorMessage;
    }
}
