package com.phillippitts.ellie.presentation.controller;

import com.phillippitts.ellie.config.logging.MdcFilter;
import com.phillippitts.ellie.domain.TextReply;
import com.phillippitts.ellie.exception.EllieException;
import com.phillippitts.ellie.exception.ErrorCode;
import com.phillippitts.ellie.service.orchestration.ResponseOrchestrator;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TextChatController.class)
class TextChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ResponseOrchestrator orchestrator;

    @Test
    void answersTextTurn() throws Exception {
        when(orchestrator.handleTextInput("sess-1", "What is the weather?"))
                .thenReturn(new TextReply("Sunny.", 321, "groq", false));

        mockMvc.perform(post("/api/chat/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"What is the weather?\",\"sessionId\":\"sess-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("Sunny."))
                .andExpect(jsonPath("$.processingTime").value(321));
    }

    @Test
    void generatesSessionIdWhenMissing() throws Exception {
        when(orchestrator.handleTextInput(anyString(), eq("hello")))
                .thenReturn(new TextReply("Hi!", 5, "groq", false));

        mockMvc.perform(post("/api/chat/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<String> sessionId = ArgumentCaptor.forClass(String.class);
        verify(orchestrator).handleTextInput(sessionId.capture(), eq("hello"));
        assertThat(sessionId.getValue()).startsWith("text-");
    }

    @Test
    void blankMessageIsRejected() throws Exception {
        mockMvc.perform(post("/api/chat/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_INPUT"));

        verify(orchestrator, never()).handleTextInput(anyString(), anyString());
    }

    @Test
    void overlongMessageIsRejected() throws Exception {
        String message = "a".repeat(TextChatController.MAX_MESSAGE_LENGTH + 1);

        mockMvc.perform(post("/api/chat/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"" + message + "\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        mockMvc.perform(post("/api/chat/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("Malformed JSON body"));
    }

    @Test
    void orchestratorFailureMapsToErrorBody() throws Exception {
        when(orchestrator.handleTextInput(anyString(), anyString()))
                .thenThrow(new EllieException(ErrorCode.SERVICE_UNAVAILABLE, "fallback broken"));

        mockMvc.perform(post("/api/chat/text")
                        .header(MdcFilter.REQUEST_ID_HEADER, "req-7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\",\"sessionId\":\"s\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("SERVICE_UNAVAILABLE"))
                .andExpect(jsonPath("$.requestId").value("req-7"));
    }
}
