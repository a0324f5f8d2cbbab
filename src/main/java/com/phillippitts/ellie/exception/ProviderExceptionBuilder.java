package com.phillippitts.ellie.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ProviderException} with contextual diagnostics.
 *
 * <p>Provider clients use it so every upstream failure carries the same detail format:
 * <pre>
 * throw ProviderExceptionBuilder.create("Chat completion failed")
 *         .provider("groq")
 *         .statusCode(429)
 *         .durationMs(812)
 *         .metadata("model", "llama3-8b-8192")
 *         .cause(e)
 *         .build();
 * </pre>
 *
 * <p>A {@link #timeout(long)} call makes {@link #build()} return a {@link ProviderTimeoutException}.
 */
public final class ProviderExceptionBuilder {

    private final String message;
    private String providerName;
    private Throwable cause;
    private Integer statusCode;
    private Long durationMs;
    private Long timeoutMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProviderExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ProviderExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProviderExceptionBuilder(message);
    }

    public ProviderExceptionBuilder provider(String providerName) {
        this.providerName = providerName;
        return this;
    }

    public ProviderExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the upstream HTTP status code.
     *
     * @param statusCode HTTP status returned by the provider
     * @return this builder for chaining
     */
    public ProviderExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public ProviderExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Marks the failure as a stage timeout.
     *
     * @param timeoutMs the timeout that was exceeded
     * @return this builder for chaining
     */
    public ProviderExceptionBuilder timeout(long timeoutMs) {
        this.timeoutMs = timeoutMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ProviderExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (status={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return a {@link ProviderTimeoutException} when a timeout was set, else a {@link ProviderException}
     */
    public ProviderException build() {
        String detailedMessage = buildDetailedMessage();
        String provider = providerName != null ? providerName : "unknown";
        if (timeoutMs != null) {
            return new ProviderTimeoutException(detailedMessage, provider, timeoutMs, cause);
        }
        return new ProviderException(detailedMessage, provider, cause);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (statusCode != null) {
            details.put("status", String.valueOf(statusCode));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        if (timeoutMs != null) {
            details.put("timeoutMs", String.valueOf(timeoutMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
