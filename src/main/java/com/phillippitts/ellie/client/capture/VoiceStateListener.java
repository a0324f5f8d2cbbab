package com.phillippitts.ellie.client.capture;

/**
 * Observer of {@link CaptureController} transitions and notices. Called on the thread that caused
 * the change; implementations must not block.
 */
public interface VoiceStateListener {

    void onStateChanged(VoiceState from, VoiceState to);

    default void onNotice(CaptureNotice notice) {
    }
}
