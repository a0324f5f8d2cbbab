package com.phillippitts.ellie.client.capture;

import com.phillippitts.ellie.exception.CaptureException;

/**
 * A microphone producing PCM16LE mono audio.
 *
 * <p>Every successful {@link #acquire()} must be paired with exactly one {@link #release()}.
 * {@link CaptureController} guarantees this, including on cancel and shutdown.
 */
public interface AudioCaptureDevice {

    /**
     * Opens and starts the device. May block while the OS asks the user for permission.
     *
     * @throws CaptureException carrying the reason when the device cannot be opened
     */
    void acquire();

    /**
     * Blocking read of captured bytes.
     *
     * @return bytes read, 0 when nothing was available, or -1 when the device stopped delivering
     */
    int read(byte[] buffer, int offset, int length);

    /** Stops and closes the device. Safe to call after a failed read. */
    void release();

    int sampleRate();
}
