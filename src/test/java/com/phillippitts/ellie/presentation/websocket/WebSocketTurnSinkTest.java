package com.phillippitts.ellie.presentation.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.ellie.exception.ErrorCode;
import com.phillippitts.ellie.service.orchestration.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketTurnSinkTest {

    private final WebSocketSession session = mock(WebSocketSession.class);
    private final WebSocketTurnSink sink = new WebSocketTurnSink(session, "sess", new ObjectMapper());

    @Test
    void errorEnvelopeCarriesCodeAndSession() throws Exception {
        when(session.isOpen()).thenReturn(true);

        sink.error(ErrorResponse.of(ErrorCode.EXTERNAL_API_ERROR, null, "req-1", "sess"));

        ArgumentCaptor<TextMessage> message = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(message.capture());
        JsonNode envelope = new ObjectMapper().readTree(message.getValue().getPayload());
        assertThat(envelope.path("type").asText()).isEqualTo("error");
        JsonNode data = envelope.path("data");
        assertThat(data.path("code").asText()).isEqualTo("EXTERNAL_API_ERROR");
        assertThat(data.path("message").asText()).isEqualTo(ErrorCode.EXTERNAL_API_ERROR.userMessage());
        assertThat(data.path("requestId").asText()).isEqualTo("req-1");
        assertThat(data.path("sessionId").asText()).isEqualTo("sess");
        assertThat(data.has("details")).isFalse();
    }

    @Test
    void closedSocketDropsEvents() throws Exception {
        when(session.isOpen()).thenReturn(false);

        assertThat(sink.send("status", Map.of())).isFalse();
        verify(session, never()).sendMessage(any());
    }

    @Test
    void detachedSinkDropsEvents() throws Exception {
        when(session.isOpen()).thenReturn(true);
        sink.detach();

        assertThat(sink.isDetached()).isTrue();
        assertThat(sink.send("status", Map.of())).isFalse();
        verify(session, never()).sendMessage(any());
    }

    @Test
    void failedWriteIsReportedNotThrown() throws Exception {
        when(session.isOpen()).thenReturn(true);
        doThrow(new IOException("broken pipe")).when(session).sendMessage(any());

        assertThat(sink.send("status", Map.of("state", "IDLE"))).isFalse();
    }
}
