package com.kspec.client;

import java.net.URI;

/** Opens client sockets to the daemon. Implementations must not block the caller. */
public interface DaemonTransport {

    void open(URI uri, TransportListener listener);
}
