package com.phillippitts.ellie.service.orchestration;

/**
 * States reported to the client in {@code status} events.
 */
public enum TurnStatus {
    LISTENING,
    PROCESSING,
    SPEAKING,
    IDLE,
    ERROR
}
