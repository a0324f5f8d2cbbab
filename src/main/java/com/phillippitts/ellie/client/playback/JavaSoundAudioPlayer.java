package com.phillippitts.ellie.client.playback;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Clip;
import javax.sound.sampled.LineEvent;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Java Sound {@link Clip} playback. Formats without an installed Java Sound provider (MP3 on a
 * bare JDK) fail the returned future; callers treat that like a finished playback.
 */
public class JavaSoundAudioPlayer implements AudioPlayer {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioPlayer.class);

    private final Object lock = new Object();
    private Clip current;

    @Override
    public CompletableFuture<Void> play(byte[] audio) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (audio == null || audio.length == 0) {
            done.complete(null);
            return done;
        }
        try (AudioInputStream stream = AudioSystem.getAudioInputStream(new ByteArrayInputStream(audio))) {
            Clip clip = AudioSystem.getClip();
            clip.addLineListener(event -> {
                if (event.getType() == LineEvent.Type.STOP) {
                    clip.close();
                    done.complete(null);
                }
            });
            clip.open(stream);
            synchronized (lock) {
                stopCurrent();
                current = clip;
            }
            clip.start();
        } catch (UnsupportedAudioFileException | LineUnavailableException | IOException e) {
            LOG.warn("Cannot play reply audio ({} bytes): {}", audio.length, e.toString());
            done.completeExceptionally(e);
        }
        return done;
    }

    @Override
    public void stop() {
        synchronized (lock) {
            stopCurrent();
        }
    }

    // Caller holds lock
    private void stopCurrent() {
        if (current != null && current.isOpen()) {
            current.stop();
        }
        current = null;
    }
}
