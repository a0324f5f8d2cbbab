package com.phillippitts.ellie.domain;

import java.util.Locale;

/**
 * One captured utterance. Exists only for the duration of a single orchestration request.
 *
 * @param data       raw audio bytes (never null)
 * @param format     declared container/codec, lower-case (e.g. "webm", "wav")
 * @param durationMs approximate duration in milliseconds, 0 when unknown
 */
public record AudioInput(byte[] data, String format, long durationMs) {

    public AudioInput {
        data = data == null ? new byte[0] : data;
        format = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must not be negative, got: " + durationMs);
        }
    }

    public int size() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }
}
