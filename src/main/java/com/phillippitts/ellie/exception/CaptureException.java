package com.phillippitts.ellie.exception;

/**
 * Thrown when the microphone cannot be acquired for a capture session.
 */
public class CaptureException extends EllieException {

    private final CaptureError captureError;

    public CaptureException(CaptureError captureError, String message) {
        this(captureError, message, null);
    }

    public CaptureException(CaptureError captureError, String message, Throwable cause) {
        super(captureError.errorCode(), message + " (" + captureError + ")", cause);
        this.captureError = captureError;
    }

    public CaptureError getCaptureError() {
        return captureError;
    }
}
