package com.kspec.client;

import java.time.Duration;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Side effect requested by {@link ReconnectionStateMachine}, carried out by
 * {@link DashboardConnectionManager}. Only {@link Type#SCHEDULE_RECONNECT} has a delay.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ClientAction {

    public enum Type {
        OPEN_SOCKET,
        CLOSE_SOCKET,
        RESET_SEQUENCE,
        RESUBSCRIBE_ALL,
        SCHEDULE_RECONNECT,
        CANCEL_RECONNECT,
        START_CONNECTION_LOST_TIMER,
        CLEAR_CONNECTION_LOST_TIMER
    }

    public static final ClientAction OPEN_SOCKET = new ClientAction(Type.OPEN_SOCKET, null);
    public static final ClientAction CLOSE_SOCKET = new ClientAction(Type.CLOSE_SOCKET, null);
    public static final ClientAction RESET_SEQUENCE = new ClientAction(Type.RESET_SEQUENCE, null);
    public static final ClientAction RESUBSCRIBE_ALL = new ClientAction(Type.RESUBSCRIBE_ALL, null);
    public static final ClientAction CANCEL_RECONNECT = new ClientAction(Type.CANCEL_RECONNECT, null);
    public static final ClientAction START_CONNECTION_LOST_TIMER =
            new ClientAction(Type.START_CONNECTION_LOST_TIMER, null);
    public static final ClientAction CLEAR_CONNECTION_LOST_TIMER =
            new ClientAction(Type.CLEAR_CONNECTION_LOST_TIMER, null);

    private final Type type;
    private final Duration delay;

    private ClientAction(Type type, Duration delay) {
        this.type = type;
        this.delay = delay;
    }

    public static ClientAction scheduleReconnect(Duration delay) {
        return new ClientAction(Type.SCHEDULE_RECONNECT, delay);
    }
}
