package com.phillippitts.ellie.service.provider;

import com.phillippitts.ellie.exception.ProviderException;

/**
 * Text-generation backend (chat completion).
 */
public interface GenerationProvider {

    /**
     * @return generated reply text, trimmed and non-empty
     * @throws ProviderException on upstream failure or an empty completion
     */
    String generate(GenerationRequest request);

    String getProviderName();

    boolean isConfigured();
}
