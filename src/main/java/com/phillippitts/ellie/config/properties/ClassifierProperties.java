package com.phillippitts.ellie.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunable thresholds for the heuristic complexity classifier and the legal routing rule.
 */
@ConfigurationProperties(prefix = "ellie.classifier")
@Validated
public class ClassifierProperties {

    /** Transcripts shorter than this are SIMPLE. */
    @Positive
    private int simpleMaxLength = 20;

    /** Multi-question transcripts longer than this are COMPLEX. */
    @Positive
    private int complexMinLength = 200;

    /** Share of words that are legal indicators at or above which a transcript is COMPLEX. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double complexKeywordDensity = 0.15;

    /** MODERATE transcripts with legal keywords longer than this go to the accurate provider. */
    @Positive
    private int legalRoutingMinLength = 50;

    public int getSimpleMaxLength() {
        return simpleMaxLength;
    }

    public void setSimpleMaxLength(int simpleMaxLength) {
        this.simpleMaxLength = simpleMaxLength;
    }

    public int getComplexMinLength() {
        return complexMinLength;
    }

    public void setComplexMinLength(int complexMinLength) {
        this.complexMinLength = complexMinLength;
    }

    public double getComplexKeywordDensity() {
        return complexKeywordDensity;
    }

    public void setComplexKeywordDensity(double complexKeywordDensity) {
        this.complexKeywordDensity = complexKeywordDensity;
    }

    public int getLegalRoutingMinLength() {
        return legalRoutingMinLength;
    }

    public void setLegalRoutingMinLength(int legalRoutingMinLength) {
        this.legalRoutingMinLength = legalRoutingMinLength;
    }
}
