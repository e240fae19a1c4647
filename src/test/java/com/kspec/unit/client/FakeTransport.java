package com.kspec.unit.client;

import com.kspec.client.DaemonTransport;
import com.kspec.client.TransportListener;
import com.kspec.client.TransportSession;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Records open requests; the test drives the listener callbacks. */
class FakeTransport implements DaemonTransport {

    private final MutableClock clock;
    private final List<TransportListener> listeners = new ArrayList<>();
    private final List<Instant> openTimes = new ArrayList<>();
    private RuntimeException openFailure;

    FakeTransport(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void open(URI uri, TransportListener listener) {
        listeners.add(listener);
        openTimes.add(clock.instant());
        if (openFailure != null) {
            throw openFailure;
        }
    }

    void failOpensWith(RuntimeException failure) {
        this.openFailure = failure;
    }

    TransportListener lastListener() {
        return listeners.get(listeners.size() - 1);
    }

    TransportListener listener(int index) {
        return listeners.get(index);
    }

    int openCount() {
        return listeners.size();
    }

    List<Instant> openTimes() {
        return openTimes;
    }

    static final class FakeSession implements TransportSession {

        final List<String> sent = new ArrayList<>();
        boolean open = true;
        Integer closeCode;
        String closeReason;

        @Override
        public void send(String text) {
            sent.add(text);
        }

        @Override
        public void close(int code, String reason) {
            open = false;
            closeCode = code;
            closeReason = reason;
        }

        @Override
        public boolean isOpen() {
            return open;
        }
    }
}
