package com.phillippitts.ellie.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable conversation message appended to a session history.
 *
 * @param id             unique message id
 * @param timestamp      creation time
 * @param role           author role
 * @param text           text content (never null, may be empty)
 * @param audioReference optional reference to delivered audio (e.g. cache fingerprint), or null
 * @param metadata       diagnostics, never null
 */
public record Message(
        String id,
        Instant timestamp,
        MessageRole role,
        String text,
        String audioReference,
        MessageMetadata metadata
) {

    public Message {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(text, "text must not be null");
        metadata = metadata == null ? MessageMetadata.none() : metadata;
    }

    public static Message user(String text) {
        return new Message(UUID.randomUUID().toString(), Instant.now(), MessageRole.USER, text, null,
                MessageMetadata.none());
    }

    public static Message assistant(String text, String audioReference, MessageMetadata metadata) {
        return new Message(UUID.randomUUID().toString(), Instant.now(), MessageRole.ASSISTANT, text,
                audioReference, metadata);
    }
}
