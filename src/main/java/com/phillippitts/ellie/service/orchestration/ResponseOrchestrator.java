package com.phillippitts.ellie.service.orchestration;

import com.phillippitts.ellie.domain.AudioInput;
import com.phillippitts.ellie.domain.TextReply;

import java.util.concurrent.CompletableFuture;

/**
 * Turns user input into an assistant reply.
 *
 * <p>Provider failures never escape: they move the turn along the fallback chain. Only invalid
 * input, or a failure of the fallback itself, ends a turn with an error.
 */
public interface ResponseOrchestrator {

    /**
     * Runs one voice turn asynchronously.
     *
     * <p>Emits {@code status} events and then exactly one {@code response} or {@code error} to the
     * sink. Turns of the same session run one at a time.
     *
     * @param sessionId session the audio belongs to
     * @param audio     captured utterance
     * @param sink      receiver of the turn's events
     * @return future completing (never exceptionally) once the turn is finished
     */
    CompletableFuture<Void> handleVoiceInput(String sessionId, AudioInput audio, TurnEventSink sink);

    /**
     * Runs one text turn on the calling thread: classification, cache, routing and fallback,
     * without transcription or synthesis.
     *
     * @throws com.phillippitts.ellie.exception.EllieException with {@code INVALID_INPUT} for blank text
     */
    TextReply handleTextInput(String sessionId, String text);
}
