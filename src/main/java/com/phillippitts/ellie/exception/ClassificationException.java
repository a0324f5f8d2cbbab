package com.phillippitts.ellie.exception;

/**
 * Thrown when a complexity classifier cannot produce a class for a transcript.
 */
public class ClassificationException extends EllieException {

    public ClassificationException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL_SERVER_ERROR, message, cause);
    }
}
