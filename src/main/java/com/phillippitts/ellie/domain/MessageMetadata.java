package com.phillippitts.ellie.domain;

/**
 * Optional diagnostics attached to a message.
 *
 * @param confidence       confidence score between 0.0 and 1.0, or null when unknown
 * @param processingTimeMs time spent producing the message, or null for user messages
 * @param provider         provider that produced the text (e.g. "groq", "fallback"), or null
 */
public record MessageMetadata(Double confidence, Long processingTimeMs, String provider) {

    public static MessageMetadata none() {
        return new MessageMetadata(null, null, null);
    }
}
