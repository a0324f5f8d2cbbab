package com.phillippitts.ellie.util;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * Wraps raw PCM16LE samples in a minimal in-memory WAV container.
 *
 * <p>Used for captured microphone audio (sent as {@code format=wav}) and for the local fallback
 * audio cue. Only 16-bit signed little-endian PCM is supported.
 */
public final class WavEncoder {

    public static final int HEADER_SIZE = 44;
    private static final int BITS_PER_SAMPLE = 16;

    private WavEncoder() {}

    /**
     * @param pcm        raw PCM16LE audio
     * @param sampleRate sample rate in Hz
     * @param channels   channel count
     * @return WAV bytes (44-byte RIFF header followed by the samples)
     */
    public static byte[] encodePcm16Le(byte[] pcm, int sampleRate, int channels) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (sampleRate <= 0 || channels <= 0) {
            throw new IllegalArgumentException("sampleRate and channels must be positive");
        }
        int blockAlign = channels * BITS_PER_SAMPLE / 8;
        ByteArrayOutputStream out = new ByteArrayOutputStream(HEADER_SIZE + pcm.length);

        out.writeBytes(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(out, 36 + pcm.length);
        out.writeBytes(new byte[] { 'W', 'A', 'V', 'E' });

        out.writeBytes(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(out, 16);
        writeLEShort(out, (short) 1); // PCM
        writeLEShort(out, (short) channels);
        writeLEInt(out, sampleRate);
        writeLEInt(out, sampleRate * blockAlign);
        writeLEShort(out, (short) blockAlign);
        writeLEShort(out, (short) BITS_PER_SAMPLE);

        out.writeBytes(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(out, pcm.length);
        out.writeBytes(pcm);
        return out.toByteArray();
    }

    private static void writeLEShort(ByteArrayOutputStream os, short v) {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(ByteArrayOutputStream os, int v) {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
