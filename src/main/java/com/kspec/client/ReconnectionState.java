package com.kspec.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable snapshot of the reconnection loop.
 *
 * <p>{@code reconnectAttempts} counts retries scheduled since the last successful open.
 * {@code manualDisconnect} is set by an explicit disconnect and suppresses retries until the next
 * connect or reset.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
@EqualsAndHashCode
public class ReconnectionState {

    private final ConnectionStatus status;
    private final int reconnectAttempts;
    private final boolean manualDisconnect;

    public static ReconnectionState initial() {
        return new ReconnectionState(ConnectionStatus.DISCONNECTED, 0, false);
    }
}
