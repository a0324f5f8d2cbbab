package com.phillippitts.ellie.exception;

/**
 * Thrown when an audio payload is empty, exceeds the size ceiling, or declares a format the
 * transcription provider does not accept.
 */
public class InvalidAudioException extends EllieException {

    private final int audioSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super(ErrorCode.INVALID_AUDIO_FORMAT, "Invalid audio data: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(int audioSize, String reason) {
        this(ErrorCode.INVALID_AUDIO_FORMAT, audioSize, reason);
    }

    public InvalidAudioException(ErrorCode errorCode, int audioSize, String reason) {
        super(errorCode, "Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
