package com.phillippitts.ellie.config.properties;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Limits applied to incoming {@code voice-input} payloads before transcription.
 *
 * <p>Note: Bean created via {@link com.phillippitts.ellie.EllieApplication}'s
 * {@code @EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "audio.validation")
@Validated
public class AudioValidationProperties {

    /**
     * Maximum payload size in bytes (guard against memory exhaustion).
     * Default: 10 MB. The transcription provider itself accepts up to 25 MB.
     */
    @Positive(message = "Maximum file size must be positive")
    private int maxFileSizeBytes = 10 * 1024 * 1024;

    /** Declared formats accepted by the transcription provider. */
    @NotEmpty
    private List<String> allowedFormats = new ArrayList<>(
            List.of("wav", "webm", "mp3", "mp4", "mpeg", "mpga", "m4a", "ogg", "pcm"));

    public int getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(int maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public List<String> getAllowedFormats() {
        return allowedFormats;
    }

    public void setAllowedFormats(List<String> allowedFormats) {
        this.allowedFormats = allowedFormats;
    }
}
