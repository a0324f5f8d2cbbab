package com.phillippitts.ellie.service.provider;

import com.phillippitts.ellie.domain.ComplexityClass;
import com.phillippitts.ellie.domain.Message;

import java.util.List;
import java.util.Objects;

/**
 * Input of one chat completion call.
 *
 * @param userText     current user utterance
 * @param history      prior messages, oldest first, already trimmed to the history window
 * @param systemPrompt system instruction
 * @param complexity   classification of the utterance
 */
public record GenerationRequest(String userText, List<Message> history, String systemPrompt,
                                ComplexityClass complexity) {

    public GenerationRequest {
        Objects.requireNonNull(userText, "userText must not be null");
        history = history == null ? List.of() : List.copyOf(history);
    }
}
