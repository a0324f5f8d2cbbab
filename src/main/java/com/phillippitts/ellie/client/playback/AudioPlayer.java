package com.phillippitts.ellie.client.playback;

import java.util.concurrent.CompletableFuture;

/**
 * Plays synthesized replies.
 */
public interface AudioPlayer {

    /**
     * @param audio encoded audio (MP3 from the server, or the WAV fallback cue)
     * @return completes when playback ends; fails when the audio cannot be played
     */
    CompletableFuture<Void> play(byte[] audio);

    /** Stops the current playback, completing its future. */
    void stop();
}
