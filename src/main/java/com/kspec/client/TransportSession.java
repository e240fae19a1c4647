package com.kspec.client;

import java.io.IOException;

/** An open client socket. */
public interface TransportSession {

    void send(String text) throws IOException;

    void close(int code, String reason);

    boolean isOpen();
}
