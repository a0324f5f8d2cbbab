package com.phillippitts.ellie.service.provider;

import com.phillippitts.ellie.config.properties.ProviderProperties;
import com.phillippitts.ellie.exception.ProviderExceptionBuilder;
import com.phillippitts.ellie.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Speech synthesis over the OpenAI audio API ({@code POST /v1/audio/speech}).
 *
 * <p>Input longer than {@code maxInputChars} is cut at the last sentence end that fits.
 */
public class OpenAiSynthesisProvider implements SynthesisProvider {

    private static final Logger LOG = LogManager.getLogger(OpenAiSynthesisProvider.class);

    static final String SPEECH_PATH = "/v1/audio/speech";

    private final WebClient webClient;
    private final ProviderProperties.SynthesisEndpoint endpoint;

    public OpenAiSynthesisProvider(WebClient webClient, ProviderProperties.SynthesisEndpoint endpoint) {
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }

    @Override
    public byte[] synthesize(String text) {
        if (!isConfigured()) {
            throw ProviderResponses.notConfigured(getProviderName());
        }
        long t0 = System.nanoTime();
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("model", endpoint.getModel());
            payload.put("voice", endpoint.getVoice());
            payload.put("input", fitInput(text, endpoint.getMaxInputChars()));
            payload.put("speed", endpoint.getSpeed());
            payload.put("response_format", endpoint.getResponseFormat());

            byte[] audio = webClient.post()
                    .uri(SPEECH_PATH)
                    .header("Authorization", "Bearer " + endpoint.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_OCTET_STREAM)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block();
            if (audio == null || audio.length == 0) {
                throw ProviderExceptionBuilder.create("Empty synthesis response")
                        .provider(getProviderName())
                        .build();
            }
            LOG.debug("Synthesized {} chars into {} bytes in {} ms", text.length(), audio.length,
                    TimeUtils.elapsedMillis(t0));
            return audio;
        } catch (RuntimeException e) {
            throw ProviderResponses.translate("Speech synthesis", getProviderName(), endpoint.getModel(), e,
                    TimeUtils.elapsedMillis(t0));
        }
    }

    static String fitInput(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        String head = text.substring(0, maxChars);
        int sentenceEnd = Math.max(head.lastIndexOf(". "), Math.max(head.lastIndexOf("? "), head.lastIndexOf("! ")));
        return sentenceEnd > 0 ? head.substring(0, sentenceEnd + 1) : head;
    }

    @Override
    public String getProviderName() {
        return ProviderNames.TTS;
    }

    @Override
    public String voice() {
        return endpoint.getVoice();
    }

    @Override
    public double speed() {
        return endpoint.getSpeed();
    }

    @Override
    public boolean isConfigured() {
        return endpoint.hasApiKey();
    }
}
