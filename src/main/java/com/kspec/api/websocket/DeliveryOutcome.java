package com.kspec.api.websocket;

/** Result of offering one broadcast event to one connection. */
public enum DeliveryOutcome {
    /** Queued for the socket and a sequence number was consumed. */
    DELIVERED,
    /** Skipped because the connection's outbound buffer is at or above the threshold. */
    DROPPED,
    /** Skipped because the connection is closing or closed. */
    CLOSED
}
