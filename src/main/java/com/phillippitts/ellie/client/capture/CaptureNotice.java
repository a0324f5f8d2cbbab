package com.phillippitts.ellie.client.capture;

import java.time.Instant;

/**
 * User-visible information about a capture that did not end the normal way.
 *
 * @param kind    what happened
 * @param message short text suitable for display
 * @param at      when it happened
 */
public record CaptureNotice(Kind kind, String message, Instant at) {

    public enum Kind {
        /** The recording ceiling stopped the microphone; the audio so far is kept. */
        MAX_DURATION_REACHED,
        /** The device stopped delivering audio mid-recording; the audio so far is kept. */
        DEVICE_LOST
    }

    static CaptureNotice maxDurationReached(long maxDurationMs) {
        return new CaptureNotice(Kind.MAX_DURATION_REACHED,
                "Recording stopped after " + (maxDurationMs / 1000) + " seconds", Instant.now());
    }

    static CaptureNotice deviceLost() {
        return new CaptureNotice(Kind.DEVICE_LOST, "Microphone stopped responding", Instant.now());
    }
}
