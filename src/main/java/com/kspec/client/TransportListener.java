package com.kspec.client;

/**
 * Callbacks from a {@link DaemonTransport}. For one {@code open} call, either {@link #onConnectFailure} is
 * called once, or {@link #onOpen} followed eventually by {@link #onClose}.
 */
public interface TransportListener {

    void onOpen(TransportSession session);

    void onMessage(String text);

    void onClose(int code, String reason);

    void onConnectFailure(Throwable cause);
}
