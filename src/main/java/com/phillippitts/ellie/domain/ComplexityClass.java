package com.phillippitts.ellie.domain;

/**
 * Estimated complexity of a user turn. Ordered from cheapest to most expensive to serve.
 */
public enum ComplexityClass {
    SIMPLE,
    MODERATE,
    COMPLEX
}
