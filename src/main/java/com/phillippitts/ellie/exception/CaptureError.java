package com.phillippitts.ellie.exception;

/**
 * Reasons a capture device could not be acquired.
 */
public enum CaptureError {
    PERMISSION_DENIED(ErrorCode.MICROPHONE_PERMISSION_DENIED, false),
    DEVICE_UNAVAILABLE(ErrorCode.AUDIO_PROCESSING_FAILED, true),
    DEVICE_BUSY(ErrorCode.AUDIO_PROCESSING_FAILED, true),
    UNSUPPORTED(ErrorCode.AUDIO_PROCESSING_FAILED, false);

    private final ErrorCode errorCode;
    private final boolean recoverable;

    CaptureError(ErrorCode errorCode, boolean recoverable) {
        this.errorCode = errorCode;
        this.recoverable = recoverable;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /** @return true if retrying later may succeed without user intervention in system settings */
    public boolean isRecoverable() {
        return recoverable;
    }
}
