package com.kspec.api.websocket;

/**
 * Lifecycle of one event-socket connection. Transitions only move forward.
 */
public enum ConnectionState {
    OPENING,
    OPEN,
    CLOSING,
    CLOSED
}
