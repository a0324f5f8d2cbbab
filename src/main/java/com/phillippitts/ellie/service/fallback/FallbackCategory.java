package com.phillippitts.ellie.service.fallback;

/**
 * Families of canned replies.
 */
public enum FallbackCategory {
    GREETING,
    GENERAL_INQUIRY,
    TECHNICAL_DIFFICULTY,
    SERVICE_UNAVAILABLE,
    LEGAL_DISCLAIMER,
    COMPLEX_QUESTION,
    OFF_TOPIC
}
