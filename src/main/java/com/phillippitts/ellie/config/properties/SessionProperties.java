package com.phillippitts.ellie.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Server-side conversation session limits.
 */
@ConfigurationProperties(prefix = "ellie.session")
@Validated
public class SessionProperties {

    /** Sessions without activity for this long are destroyed by the cleanup sweep. */
    @Positive
    private long idleTimeoutMinutes = 30;

    /** How long a session outlives its last closed socket, waiting for a reconnect. */
    @PositiveOrZero
    private long disconnectGraceSeconds = 120;

    /** History entries kept per session; oldest are dropped first. */
    @Positive
    private int maxHistoryMessages = 50;

    public long getIdleTimeoutMinutes() {
        return idleTimeoutMinutes;
    }

    public void setIdleTimeoutMinutes(long idleTimeoutMinutes) {
        this.idleTimeoutMinutes = idleTimeoutMinutes;
    }

    public long getDisconnectGraceSeconds() {
        return disconnectGraceSeconds;
    }

    public void setDisconnectGraceSeconds(long disconnectGraceSeconds) {
        this.disconnectGraceSeconds = disconnectGraceSeconds;
    }

    public int getMaxHistoryMessages() {
        return maxHistoryMessages;
    }

    public void setMaxHistoryMessages(int maxHistoryMessages) {
        this.maxHistoryMessages = maxHistoryMessages;
    }
}
