package com.phillippitts.ellie.presentation.controller;

import com.phillippitts.ellie.domain.TextReply;
import com.phillippitts.ellie.service.orchestration.ResponseOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Text channel of the assistant. Used by clients that lost voice and by simple integrations.
 * Runs the same pipeline as voice turns, minus transcription and synthesis.
 */
@RestController
@RequestMapping("/api/chat")
class TextChatController {

    private static final Logger LOG = LogManager.getLogger(TextChatController.class);

    static final int MAX_MESSAGE_LENGTH = 2000;

    private final ResponseOrchestrator orchestrator;

    TextChatController(ResponseOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/text")
    ResponseEntity<TextChatResponse> chat(@Valid @RequestBody TextChatRequest request) {
        String sessionId = request.sessionId() == null || request.sessionId().isBlank()
                ? "text-" + UUID.randomUUID()
                : request.sessionId();
        ThreadContext.put("sessionId", sessionId);
        TextReply reply = orchestrator.handleTextInput(sessionId, request.message());
        LOG.info("Text turn answered: provider={}, fallback={}, {}ms",
                reply.provider(), reply.fallback(), reply.processingTimeMs());
        return ResponseEntity.ok(new TextChatResponse(reply.response(), reply.processingTimeMs()));
    }

    record TextChatRequest(
            @NotBlank @Size(max = MAX_MESSAGE_LENGTH) String message,
            String sessionId
    ) {}

    record TextChatResponse(String response, long processingTime) {}
}
