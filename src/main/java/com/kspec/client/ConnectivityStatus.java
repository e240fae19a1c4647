package com.kspec.client;

/**
 * What the dashboard shows the user. Derived from {@link ConnectionStatus} plus how long the client has
 * been without a connection.
 */
public enum ConnectivityStatus {
    CONNECTED("Connected"),
    RECONNECTING("Reconnecting"),
    DISCONNECTED("Disconnected"),
    CONNECTION_LOST("Connection Lost");

    private final String label;

    ConnectivityStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
