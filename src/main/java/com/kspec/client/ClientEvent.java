package com.kspec.client;

/** Inputs to {@link ReconnectionStateMachine}. */
public enum ClientEvent {
    /** Application asked to connect. */
    CONNECT_REQUESTED,
    /** Transport handshake completed. */
    SOCKET_OPENED,
    /** Server sent its {@code connected} event with the session id. */
    SESSION_ESTABLISHED,
    /** An open socket closed without the application asking for it. */
    SOCKET_CLOSED,
    /** A connect attempt failed before the socket opened. */
    CONNECT_FAILED,
    RECONNECT_TIMER_FIRED,
    DISCONNECT_REQUESTED,
    /** Start over with a fresh retry budget, also from GIVEN_UP. */
    RESET_REQUESTED
}
