package com.kspec.client;

import java.util.List;
import lombok.Getter;
import lombok.ToString;

/** Next state plus the side effects to perform, in order. */
@Getter
@ToString
public class Transition {

    private final ReconnectionState state;
    private final List<ClientAction> actions;

    public Transition(ReconnectionState state, List<ClientAction> actions) {
        this.state = state;
        this.actions = List.copyOf(actions);
    }

    public static Transition stay(ReconnectionState state) {
        return new Transition(state, List.of());
    }
}
