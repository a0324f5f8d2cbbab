package com.phillippitts.ellie.service.orchestration;

import com.phillippitts.ellie.exception.ErrorCode;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal failure of a turn, delivered as an {@code error} event.
 *
 * @param code      wire error code
 * @param message   user-safe message
 * @param details   optional diagnostic detail, null when none
 * @param timestamp creation time
 * @param requestId id of the turn
 * @param sessionId session of the turn
 */
public record ErrorResponse(
        ErrorCode code,
        String message,
        String details,
        Instant timestamp,
        String requestId,
        String sessionId
) {

    public ErrorResponse {
        Objects.requireNonNull(code, "code");
        message = message == null ? code.userMessage() : message;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ErrorResponse of(ErrorCode code, String details, String requestId, String sessionId) {
        return new ErrorResponse(code, code.userMessage(), details, Instant.now(), requestId, sessionId);
    }
}
