package com.phillippitts.ellie.domain;

/** Author of a conversation message. */
public enum MessageRole {
    USER,
    ASSISTANT
}
