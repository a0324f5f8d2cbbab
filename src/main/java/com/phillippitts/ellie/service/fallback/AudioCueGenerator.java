package com.phillippitts.ellie.service.fallback;

import com.phillippitts.ellie.util.WavEncoder;

import java.io.ByteArrayOutputStream;

/**
 * Builds the short two-note chime played in place of synthesized speech.
 *
 * <p>Output is a WAV file at 16 kHz, mono. Each note fades in and out linearly to avoid clicks.
 */
final class AudioCueGenerator {

    static final int SAMPLE_RATE = 16_000;

    private static final double[] NOTES_HZ = {660.0, 880.0};
    private static final int NOTE_MILLIS = 150;
    private static final int FADE_MILLIS = 15;
    private static final double AMPLITUDE = 0.3;

    private AudioCueGenerator() {
    }

    static byte[] chime() {
        ByteArrayOutputStream pcm = new ByteArrayOutputStream();
        for (double frequency : NOTES_HZ) {
            writeTone(pcm, frequency);
        }
        return WavEncoder.encodePcm16Le(pcm.toByteArray(), SAMPLE_RATE, 1);
    }

    private static void writeTone(ByteArrayOutputStream out, double frequency) {
        int samples = SAMPLE_RATE * NOTE_MILLIS / 1000;
        int fadeSamples = SAMPLE_RATE * FADE_MILLIS / 1000;
        for (int i = 0; i < samples; i++) {
            double envelope = Math.min(1.0, Math.min(i, samples - 1 - i) / (double) fadeSamples);
            double value = Math.sin(2 * Math.PI * frequency * i / SAMPLE_RATE) * AMPLITUDE * envelope;
            short sample = (short) Math.round(value * Short.MAX_VALUE);
            out.write(sample & 0xFF);
            out.write((sample >> 8) & 0xFF);
        }
    }
}
