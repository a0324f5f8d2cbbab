package com.phillippitts.ellie.service.provider;

import com.phillippitts.ellie.domain.AudioInput;
import com.phillippitts.ellie.domain.TranscriptionResult;
import com.phillippitts.ellie.exception.ProviderException;

/**
 * Speech-to-text backend.
 *
 * <p>Calls block the caller; the orchestrator bounds them with a stage timeout on the provider
 * executor. Implementations must be thread-safe.
 */
public interface TranscriptionProvider {

    /**
     * @param audio validated audio
     * @return transcription (text may be empty for silence)
     * @throws ProviderException on upstream failure
     */
    TranscriptionResult transcribe(AudioInput audio);

    String getProviderName();

    /** @return false when the provider cannot be called at all (e.g. missing API key) */
    boolean isConfigured();
}
