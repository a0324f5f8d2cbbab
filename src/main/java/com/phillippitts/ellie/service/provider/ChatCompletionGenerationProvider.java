package com.phillippitts.ellie.service.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.ellie.config.properties.ProviderProperties;
import com.phillippitts.ellie.domain.Message;
import com.phillippitts.ellie.domain.MessageRole;
import com.phillippitts.ellie.exception.ProviderExceptionBuilder;
import com.phillippitts.ellie.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Generation over an OpenAI-compatible {@code /v1/chat/completions} endpoint.
 *
 * <p>One class serves both tiers: Groq for the fast provider and OpenAI for the accurate one.
 * They differ only in base URL, key, model and sampling parameters.
 */
public class ChatCompletionGenerationProvider implements GenerationProvider {

    private static final Logger LOG = LogManager.getLogger(ChatCompletionGenerationProvider.class);

    static final String COMPLETIONS_PATH = "/v1/chat/completions";
    private static final double TOP_P = 0.9;

    private final String providerName;
    private final WebClient webClient;
    private final ProviderProperties.ChatEndpoint endpoint;
    private final ObjectMapper objectMapper;

    public ChatCompletionGenerationProvider(String providerName,
                                            WebClient webClient,
                                            ProviderProperties.ChatEndpoint endpoint,
                                            ObjectMapper objectMapper) {
        this.providerName = Objects.requireNonNull(providerName, "providerName");
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public String generate(GenerationRequest request) {
        if (!isConfigured()) {
            throw ProviderResponses.notConfigured(providerName);
        }
        long t0 = System.nanoTime();
        try {
            String body = webClient.post()
                    .uri(COMPLETIONS_PATH)
                    .header("Authorization", "Bearer " + endpoint.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload(request))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            String reply = parseReply(body);
            LOG.debug("{} generated {} chars in {} ms (model={}, history={})", providerName, reply.length(),
                    TimeUtils.elapsedMillis(t0), endpoint.getModel(), request.history().size());
            return reply;
        } catch (RuntimeException e) {
            throw ProviderResponses.translate("Chat completion", providerName, endpoint.getModel(), e,
                    TimeUtils.elapsedMillis(t0));
        }
    }

    Map<String, Object> payload(GenerationRequest request) {
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        for (Message m : request.history()) {
            if (m.text().isBlank()) {
                continue;
            }
            messages.add(Map.of("role", m.role() == MessageRole.USER ? "user" : "assistant", "content", m.text()));
        }
        messages.add(Map.of("role", "user", "content", request.userText()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", endpoint.getModel());
        payload.put("messages", messages);
        payload.put("temperature", endpoint.getTemperature());
        payload.put("max_tokens", endpoint.getMaxTokens());
        payload.put("top_p", TOP_P);
        payload.put("stream", false);
        return payload;
    }

    private String parseReply(String body) {
        String content = null;
        if (body != null) {
            try {
                JsonNode root = objectMapper.readTree(body);
                content = root.path("choices").path(0).path("message").path("content").asText(null);
            } catch (JsonProcessingException e) {
                throw ProviderExceptionBuilder.create("Unparseable completion response")
                        .provider(providerName)
                        .cause(e)
                        .build();
            }
        }
        if (content == null || content.isBlank()) {
            throw ProviderExceptionBuilder.create("No response generated")
                    .provider(providerName)
                    .metadata("model", endpoint.getModel())
                    .build();
        }
        return content.trim();
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    @Override
    public boolean isConfigured() {
        return endpoint.hasApiKey();
    }
}
