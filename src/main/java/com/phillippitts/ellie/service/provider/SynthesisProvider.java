package com.phillippitts.ellie.service.provider;

import com.phillippitts.ellie.exception.ProviderException;

/**
 * Text-to-speech backend. Voice parameters are fixed per instance and take part in the audio
 * cache fingerprint.
 */
public interface SynthesisProvider {

    /**
     * @throws ProviderException on upstream failure
     */
    byte[] synthesize(String text);

    String getProviderName();

    String voice();

    double speed();

    boolean isConfigured();
}
