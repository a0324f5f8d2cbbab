package com.phillippitts.ellie.service.validation;

import com.phillippitts.ellie.config.properties.AudioValidationProperties;
import com.phillippitts.ellie.domain.AudioInput;
import com.phillippitts.ellie.exception.ErrorCode;
import com.phillippitts.ellie.exception.InvalidAudioException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * First stage of every voice turn: rejects payloads the transcription provider would not accept.
 *
 * <p>Checks, in order: non-empty, size ceiling, declared format on the allow-list. WAV payloads
 * also need a RIFF/WAVE header so a mislabelled upload fails here and not at the provider.
 */
@Component
public class AudioValidator {

    private static final int RIFF_HEADER_SIZE = 12;

    private final AudioValidationProperties props;
    private final Set<String> allowedFormats;

    public AudioValidator(AudioValidationProperties props) {
        this.props = props;
        this.allowedFormats = props.getAllowedFormats().stream()
                .map(f -> f.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Validate a complete utterance before transcription.
     *
     * @param input audio payload with its declared format
     * @throws InvalidAudioException when a constraint is violated
     */
    public void validate(AudioInput input) {
        if (input == null || input.isEmpty()) {
            throw new InvalidAudioException("Audio data is empty");
        }

        if (input.size() > props.getMaxFileSizeBytes()) {
            throw new InvalidAudioException(ErrorCode.AUDIO_TOO_LARGE, input.size(),
                    "Audio payload too large: " + input.size() + " bytes. Max: "
                    + props.getMaxFileSizeBytes() + " bytes ("
                    + (props.getMaxFileSizeBytes() / (1024 * 1024)) + " MB)");
        }

        if (input.format().isEmpty() || !allowedFormats.contains(input.format())) {
            throw new InvalidAudioException(input.size(),
                    "Unsupported audio format '" + input.format() + "'. Allowed: " + allowedFormats);
        }

        if ("wav".equals(input.format()) && !isWav(input.data())) {
            throw new InvalidAudioException(input.size(), "Declared wav but RIFF/WAVE header is missing");
        }
    }

    private boolean isWav(byte[] a) {
        return a.length >= RIFF_HEADER_SIZE
            && a[0] == 'R' && a[1] == 'I' && a[2] == 'F' && a[3] == 'F'
            && a[8] == 'W' && a[9] == 'A' && a[10] == 'V' && a[11] == 'E';
    }
}
