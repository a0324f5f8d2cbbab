package com.phillippitts.ellie.exception;

/**
 * Cache read or write failure. Never surfaced to users; callers treat it as a miss.
 */
public class CacheException extends EllieException {

    private final String fingerprint;

    public CacheException(String message, String fingerprint, Throwable cause) {
        super(ErrorCode.INTERNAL_SERVER_ERROR, message, cause);
        this.fingerprint = fingerprint;
    }

    public String getFingerprint() {
        return fingerprint;
    }
}
