package com.phillippitts.ellie.client.degradation;

import com.fasterxml.jackson.databind.JsonNode;
import com.phillippitts.ellie.exception.EllieException;
import com.phillippitts.ellie.exception.ErrorCode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TextChannel} over {@code POST /api/chat/text}.
 */
public class HttpTextChannel implements TextChannel {

    private static final Logger LOG = LogManager.getLogger(HttpTextChannel.class);

    static final String CHAT_PATH = "/api/chat/text";

    private final WebClient webClient;
    private final Duration timeout;

    /**
     * @param webClient client whose base URL points at the server
     * @param timeout   maximum wait for a reply
     */
    public HttpTextChannel(WebClient webClient, Duration timeout) {
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public Reply send(String sessionId, String message) {
        JsonNode body;
        try {
            body = webClient.post()
                    .uri(CHAT_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("message", message, "sessionId", sessionId))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);
        } catch (WebClientResponseException e) {
            LOG.warn("Text chat rejected: HTTP {}", e.getStatusCode().value());
            ErrorCode code = e.getStatusCode().is4xxClientError() ? ErrorCode.INVALID_INPUT : ErrorCode.SERVICE_UNAVAILABLE;
            throw new EllieException(code, "Text chat failed with HTTP " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            LOG.warn("Text chat unreachable: {}", e.getMessage());
            throw new EllieException(ErrorCode.NETWORK_ERROR, "Server unreachable", e);
        } catch (IllegalStateException e) {
            // block(timeout) expired
            throw new EllieException(ErrorCode.CONNECTION_TIMEOUT, "No text reply within " + timeout.toMillis() + "ms", e);
        }
        if (body == null || !body.path("response").isTextual()) {
            throw new EllieException(ErrorCode.EXTERNAL_API_ERROR, "Text chat reply had no response field");
        }
        return new Reply(body.path("response").asText(), body.path("processingTime").asLong(0L));
    }
}
