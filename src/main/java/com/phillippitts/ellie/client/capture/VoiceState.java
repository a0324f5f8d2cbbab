package com.phillippitts.ellie.client.capture;

/**
 * Client-side voice interaction state.
 *
 * <pre>
 * IDLE -> LISTENING -> PROCESSING -> SPEAKING -> IDLE
 *   any -> ERROR -> IDLE (retry)
 * </pre>
 */
public enum VoiceState {
    IDLE,
    LISTENING,
    PROCESSING,
    SPEAKING,
    ERROR
}
