package com.phillippitts.ellie.exception;

/**
 * Base exception for all Ellie application-specific errors.
 * All domain exceptions extend this class so the REST and WebSocket boundaries can map them
 * to a single {@link ErrorCode}.
 */
public class EllieException extends RuntimeException {

    private final ErrorCode errorCode;

    public EllieException(String message) {
        this(ErrorCode.INTERNAL_SERVER_ERROR, message);
    }

    public EllieException(String message, Throwable cause) {
        this(ErrorCode.INTERNAL_SERVER_ERROR, message, cause);
    }

    public EllieException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public EllieException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
