package com.phillippitts.ellie.exception;

/**
 * Provider call exceeded its stage timeout.
 */
public class ProviderTimeoutException extends ProviderException {

    private final long timeoutMs;

    public ProviderTimeoutException(String providerName, long timeoutMs) {
        this("timed out after " + timeoutMs + "ms", providerName, timeoutMs, null);
    }

    public ProviderTimeoutException(String message, String providerName, long timeoutMs, Throwable cause) {
        super(ErrorCode.CONNECTION_TIMEOUT, message, providerName, cause);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
