package com.phillippitts.ellie.service.orchestration;

import com.phillippitts.ellie.domain.AudioResponse;

/**
 * Receiver of the events of one voice turn.
 *
 * <p>The orchestrator calls {@link #status} any number of times, then exactly one of
 * {@link #response} or {@link #error}. Calls may come from any thread but never concurrently
 * for the same turn.
 */
public interface TurnEventSink {

    void status(TurnStatus state, String message);

    void response(AudioResponse response);

    void error(ErrorResponse error);

    /** Sink that drops everything. */
    static TurnEventSink discarding() {
        return new TurnEventSink() {
            @Override
            public void status(TurnStatus state, String message) {
            }

            @Override
            public void response(AudioResponse response) {
            }

            @Override
            public void error(ErrorResponse error) {
            }
        };
    }
}
