package com.phillippitts.ellie.exception;

/**
 * Provider is not callable right now: circuit open, concurrency cap reached, or not configured.
 * No upstream request was made.
 */
public class ProviderUnavailableException extends ProviderException {

    public ProviderUnavailableException(String message, String providerName) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message, providerName, null);
    }

    public ProviderUnavailableException(String message, String providerName, Throwable cause) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message, providerName, cause);
    }
}
