package com.phillippitts.ellie.service.cache;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheFingerprintsTest {

    @Test
    void equivalentTranscriptsShareFingerprint() {
        assertThat(CacheFingerprints.text("  Hello   there!  "))
                .isEqualTo(CacheFingerprints.text("hello there"));
    }

    @Test
    void differentTranscriptsDiffer() {
        assertThat(CacheFingerprints.text("hello")).isNotEqualTo(CacheFingerprints.text("goodbye"));
    }

    @Test
    void audioFingerprintDependsOnVoiceAndSpeed() {
        String base = CacheFingerprints.audio("Hi there.", "nova", 1.0);
        assertThat(CacheFingerprints.audio("hi there", "NOVA", 1.0)).isEqualTo(base);
        assertThat(CacheFingerprints.audio("hi there", "alloy", 1.0)).isNotEqualTo(base);
        assertThat(CacheFingerprints.audio("hi there", "nova", 1.25)).isNotEqualTo(base);
    }

    @Test
    void kindsAreNamespaced() {
        assertThat(CacheFingerprints.text("x")).startsWith("text:");
        assertThat(CacheFingerprints.audio("x", "nova", 1.0)).startsWith("audio:");
    }

    @Test
    void normalizeHandlesNull() {
        assertThat(CacheFingerprints.normalize(null)).isEmpty();
    }
}
