package edu.uconn.imat.common.errorcode;

/**
 * Contract for loader error codes.
 */
public interface IErrorCode {

    /**
     * Stable error code
     */
    String code();

    /**
     * Default human-readable message
     */
    String message();
}
