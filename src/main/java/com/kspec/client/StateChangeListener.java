package com.kspec.client;

@FunctionalInterface
public interface StateChangeListener {

    void onStateChange(ConnectionStatus status, ConnectivityStatus connectivity);
}
