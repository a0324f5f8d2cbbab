package com.phillippitts.ellie.service.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.ellie.config.properties.ProviderProperties;
import com.phillippitts.ellie.domain.AudioInput;
import com.phillippitts.ellie.domain.TranscriptionResult;
import com.phillippitts.ellie.exception.ProviderExceptionBuilder;
import com.phillippitts.ellie.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Objects;

/**
 * Whisper transcription over the OpenAI audio API ({@code POST /v1/audio/transcriptions}).
 *
 * <p>The API does not report a confidence score; results carry a fixed {@link #REPORTED_CONFIDENCE}.
 */
public class OpenAiTranscriptionProvider implements TranscriptionProvider {

    private static final Logger LOG = LogManager.getLogger(OpenAiTranscriptionProvider.class);

    static final String TRANSCRIPTIONS_PATH = "/v1/audio/transcriptions";
    static final double REPORTED_CONFIDENCE = 0.9;

    private final WebClient webClient;
    private final ProviderProperties.Endpoint endpoint;
    private final ObjectMapper objectMapper;

    public OpenAiTranscriptionProvider(WebClient webClient, ProviderProperties.Endpoint endpoint,
                                       ObjectMapper objectMapper) {
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public TranscriptionResult transcribe(AudioInput audio) {
        if (!isConfigured()) {
            throw ProviderResponses.notConfigured(getProviderName());
        }
        long t0 = System.nanoTime();
        try {
            String body = callOpenAi(audio);
            String text = parseText(body);
            LOG.debug("Transcribed {} bytes ({}) in {} ms", audio.size(), audio.format(),
                    TimeUtils.elapsedMillis(t0));
            return TranscriptionResult.of(text, REPORTED_CONFIDENCE, getProviderName());
        } catch (RuntimeException e) {
            throw ProviderResponses.translate("Transcription", getProviderName(), endpoint.getModel(), e,
                    TimeUtils.elapsedMillis(t0));
        }
    }

    private String callOpenAi(AudioInput audio) {
        String format = audio.format().isEmpty() ? "wav" : audio.format();
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", audio.data())
                .header("Content-Disposition", "form-data; name=file; filename=audio." + format)
                .contentType(MediaType.APPLICATION_OCTET_STREAM);
        builder.part("model", endpoint.getModel());
        builder.part("response_format", "json");

        return webClient.post()
                .uri(TRANSCRIPTIONS_PATH)
                .header("Authorization", "Bearer " + endpoint.getApiKey())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .retrieve()
                .bodyToMono(String.class)
                .block();
    }

    private String parseText(String body) {
        if (body == null) {
            throw ProviderExceptionBuilder.create("Empty transcription response")
                    .provider(getProviderName())
                    .build();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            return root.path("text").asText("").trim();
        } catch (JsonProcessingException e) {
            throw ProviderExceptionBuilder.create("Unparseable transcription response")
                    .provider(getProviderName())
                    .cause(e)
                    .build();
        }
    }

    @Override
    public String getProviderName() {
        return ProviderNames.WHISPER;
    }

    @Override
    public boolean isConfigured() {
        return endpoint.hasApiKey();
    }
}
