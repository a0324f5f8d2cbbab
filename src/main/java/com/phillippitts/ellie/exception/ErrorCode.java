package com.phillippitts.ellie.exception;

/**
 * Wire-level error codes carried in {@code error} events and REST error bodies.
 *
 * <p>Each code has a user-safe default message. Internal details never leave the server.
 */
public enum ErrorCode {
    AUDIO_PROCESSING_FAILED("Failed to process audio. Please try again."),
    INVALID_AUDIO_FORMAT("Invalid audio format. Please record again."),
    AUDIO_TOO_LARGE("Audio recording is too long. Please keep it shorter."),
    MICROPHONE_PERMISSION_DENIED("Microphone access is required for voice input."),
    EXTERNAL_API_ERROR("AI service is temporarily unavailable. Please try again."),
    RATE_LIMIT_EXCEEDED("Too many requests. Please wait a moment before trying again."),
    NETWORK_ERROR("Network connection issue. Please check your connection."),
    CONNECTION_TIMEOUT("Request timed out. Please try again."),
    WEBSOCKET_CONNECTION_FAILED("Connection lost. Reconnecting..."),
    INVALID_INPUT("Invalid input provided. Please check your request."),
    INTERNAL_SERVER_ERROR("Something went wrong. Please try again."),
    SERVICE_UNAVAILABLE("Service is temporarily unavailable. Please try again later.");

    private final String userMessage;

    ErrorCode(String userMessage) {
        this.userMessage = userMessage;
    }

    public String userMessage() {
        return userMessage;
    }
}
