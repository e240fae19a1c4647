package com.kspec.client;

/** Protocol-level state of the client's reconnection loop. */
public enum ConnectionStatus {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    /** Retry budget exhausted; only {@code reset()} leaves this state. */
    GIVEN_UP
}
