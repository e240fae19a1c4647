package com.kspec.client;

import java.time.Duration;
import java.util.List;

/**
 * Pure transition function of the client's reconnection loop. No clocks, threads or sockets: given a state
 * and an event it returns the next state and the side effects to run.
 *
 * <p>Backoff: retry n (1-based) waits {@code min(2^(n-1), 30)} seconds, so 1s, 2s, 4s, 8s, 16s, 30s, 30s...
 * At most {@value #MAX_RECONNECT_ATTEMPTS} retries are scheduled; the close that follows the last one moves
 * to {@link ConnectionStatus#GIVEN_UP}. A successful open resets the count.
 *
 * <p>Every successful open resets the sequence watermark. The server's {@code connected} event then
 * triggers a second reset plus resubscription of every wanted topic, since subscriptions do not survive
 * a reconnect.
 */
public final class ReconnectionStateMachine {

    static final Duration INITIAL_RECONNECT_DELAY = Duration.ofSeconds(1);
    static final Duration MAX_RECONNECT_DELAY = Duration.ofSeconds(30);
    public static final int MAX_RECONNECT_ATTEMPTS = 10;

    public Transition next(ReconnectionState state, ClientEvent event) {
        return switch (event) {
            case CONNECT_REQUESTED -> onConnectRequested(state);
            case SOCKET_OPENED -> onSocketOpened(state);
            case SESSION_ESTABLISHED -> onSessionEstablished(state);
            case SOCKET_CLOSED, CONNECT_FAILED -> onConnectionLost(state);
            case RECONNECT_TIMER_FIRED -> onReconnectTimerFired(state);
            case DISCONNECT_REQUESTED -> onDisconnectRequested(state);
            case RESET_REQUESTED -> onResetRequested(state);
        };
    }

    /**
     * Computes exponential backoff delay for 1-based attempt {@code attempt}, capped at 30s.
     */
    public static Duration computeReconnectDelay(int attempt) {
        if (attempt < 1) {
            return INITIAL_RECONNECT_DELAY;
        }
        if (attempt > 16) {
            return MAX_RECONNECT_DELAY;
        }
        Duration delay = INITIAL_RECONNECT_DELAY.multipliedBy(1L << (attempt - 1));
        return delay.compareTo(MAX_RECONNECT_DELAY) > 0 ? MAX_RECONNECT_DELAY : delay;
    }

    private Transition onConnectRequested(ReconnectionState state) {
        // already working on it, or waiting for reset()
        if (state.getStatus() != ConnectionStatus.DISCONNECTED) {
            return Transition.stay(state);
        }
        ReconnectionState next = new ReconnectionState(ConnectionStatus.CONNECTING, 0, false);
        return new Transition(next, List.of(ClientAction.OPEN_SOCKET));
    }

    private Transition onSocketOpened(ReconnectionState state) {
        if (state.getStatus() != ConnectionStatus.CONNECTING) {
            return new Transition(state, List.of(ClientAction.CLOSE_SOCKET));
        }
        ReconnectionState next = new ReconnectionState(ConnectionStatus.CONNECTED, 0, false);
        return new Transition(
                next, List.of(ClientAction.CLEAR_CONNECTION_LOST_TIMER, ClientAction.RESET_SEQUENCE));
    }

    private Transition onSessionEstablished(ReconnectionState state) {
        if (state.getStatus() != ConnectionStatus.CONNECTED) {
            return Transition.stay(state);
        }
        return new Transition(state, List.of(ClientAction.RESET_SEQUENCE, ClientAction.RESUBSCRIBE_ALL));
    }

    private Transition onConnectionLost(ReconnectionState state) {
        ConnectionStatus status = state.getStatus();
        if (state.isManualDisconnect()
                || status == ConnectionStatus.DISCONNECTED
                || status == ConnectionStatus.GIVEN_UP) {
            return Transition.stay(state);
        }

        int attempts = state.getReconnectAttempts();
        if (attempts >= MAX_RECONNECT_ATTEMPTS) {
            ReconnectionState next = state.toBuilder().status(ConnectionStatus.GIVEN_UP).build();
            return new Transition(next, List.of(ClientAction.START_CONNECTION_LOST_TIMER));
        }

        int attempt = attempts + 1;
        ReconnectionState next = state.toBuilder()
                .status(ConnectionStatus.RECONNECTING)
                .reconnectAttempts(attempt)
                .build();
        return new Transition(
                next,
                List.of(
                        ClientAction.START_CONNECTION_LOST_TIMER,
                        ClientAction.scheduleReconnect(computeReconnectDelay(attempt))));
    }

    private Transition onReconnectTimerFired(ReconnectionState state) {
        if (state.getStatus() != ConnectionStatus.RECONNECTING) {
            return Transition.stay(state);
        }
        ReconnectionState next = state.toBuilder().status(ConnectionStatus.CONNECTING).build();
        return new Transition(next, List.of(ClientAction.OPEN_SOCKET));
    }

    private Transition onDisconnectRequested(ReconnectionState state) {
        ReconnectionState next = new ReconnectionState(ConnectionStatus.DISCONNECTED, 0, true);
        return new Transition(
                next,
                List.of(
                        ClientAction.CANCEL_RECONNECT,
                        ClientAction.CLEAR_CONNECTION_LOST_TIMER,
                        ClientAction.CLOSE_SOCKET));
    }

    private Transition onResetRequested(ReconnectionState state) {
        ReconnectionState next = new ReconnectionState(ConnectionStatus.CONNECTING, 0, false);
        return new Transition(
                next, List.of(ClientAction.CANCEL_RECONNECT, ClientAction.CLOSE_SOCKET, ClientAction.OPEN_SOCKET));
    }
}
