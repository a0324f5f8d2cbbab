package com.phillippitts.ellie.client.degradation;

public enum InteractionMode {
    VOICE,
    TEXT
}
