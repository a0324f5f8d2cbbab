package com.phillippitts.ellie.service.provider;

import com.phillippitts.ellie.exception.ProviderException;
import com.phillippitts.ellie.exception.ProviderExceptionBuilder;
import com.phillippitts.ellie.exception.ProviderUnavailableException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Maps WebClient failures to the provider exception hierarchy.
 */
final class ProviderResponses {

    private ProviderResponses() {
    }

    static ProviderException translate(String operation, String provider, String model, RuntimeException e,
                                       long durationMs) {
        if (e instanceof ProviderException pe) {
            return pe;
        }
        ProviderExceptionBuilder builder = ProviderExceptionBuilder.create(operation + " failed")
                .provider(provider)
                .durationMs(durationMs)
                .metadata("model", model)
                .cause(e);
        if (e instanceof WebClientResponseException wre) {
            builder.statusCode(wre.getStatusCode().value());
        } else if (e instanceof WebClientRequestException) {
            builder.metadata("transport", "request-failed");
        }
        return builder.build();
    }

    static ProviderUnavailableException notConfigured(String provider) {
        return new ProviderUnavailableException("No API key configured", provider);
    }
}
