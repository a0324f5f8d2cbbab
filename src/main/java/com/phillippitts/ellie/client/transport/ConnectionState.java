package com.phillippitts.ellie.client.transport;

public enum ConnectionState {
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    DISCONNECTED,
    /** Automatic reconnects exhausted; only {@code forceReconnect()} leaves this state. */
    FAILED
}
