package com.phillippitts.ellie.exception;

/**
 * Thrown when an upstream provider (transcription, generation or synthesis) fails.
 * The orchestrator catches it at the stage boundary and moves to the next fallback step.
 */
public class ProviderException extends EllieException {

    private final String providerName;

    public ProviderException(String message, String providerName) {
        this(ErrorCode.EXTERNAL_API_ERROR, message, providerName, null);
    }

    public ProviderException(String message, String providerName, Throwable cause) {
        this(ErrorCode.EXTERNAL_API_ERROR, message, providerName, cause);
    }

    protected ProviderException(ErrorCode errorCode, String message, String providerName, Throwable cause) {
        super(errorCode, message + " (provider: " + providerName + ")", cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
