package com.kspec.protocol;

/**
 * WebSocket close codes used by the protocol (RFC 6455 section 7.4.1).
 */
public final class CloseCodes {

    /** Server shutdown or a clean client disconnect. */
    public static final int NORMAL = 1000;

    /** Heartbeat timeout eviction. */
    public static final int GOING_AWAY = 1001;

    private CloseCodes() {}
}
