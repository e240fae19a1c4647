package com.kspec.protocol;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/**
 * Actions a client may request over the socket.
 */
public enum CommandAction {
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe"),
    PING("ping");

    private final String wireValue;

    CommandAction(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Resolves the wire value exactly (case-sensitive). Unknown values yield empty.
     */
    public static Optional<CommandAction> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(a -> a.wireValue.equals(value)).findFirst();
    }
}
