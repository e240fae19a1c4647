package com.kspec.api.websocket;

import com.kspec.protocol.CloseCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

/**
 * Starts the heartbeat and the send watchdog with the application context and, on shutdown, closes
 * every client with 1000 before both are stopped. Runs in the last phase so it stops before the web server does.
 */
@Component
public class WebSocketLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WebSocketLifecycle.class);

    static final CloseStatus SERVER_SHUTDOWN = new CloseStatus(CloseCodes.NORMAL, "Server shutting down");

    private final TopicRegistry topicRegistry;
    private final HeartbeatManager heartbeatManager;
    private final SendTimeoutWatchdog sendTimeoutWatchdog;

    private volatile boolean running;

    public WebSocketLifecycle(
            TopicRegistry topicRegistry, HeartbeatManager heartbeatManager, SendTimeoutWatchdog sendTimeoutWatchdog) {
        this.topicRegistry = topicRegistry;
        this.heartbeatManager = heartbeatManager;
        this.sendTimeoutWatchdog = sendTimeoutWatchdog;
    }

    @Override
    public void start() {
        heartbeatManager.start();
        sendTimeoutWatchdog.start();
        running = true;
    }

    @Override
    public void stop() {
        int closed = topicRegistry.shutdown(SERVER_SHUTDOWN);
        heartbeatManager.stop();
        sendTimeoutWatchdog.stop();
        running = false;
        log.info("WebSocket layer stopped, closed {} connection(s)", closed);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return SmartLifecycle.DEFAULT_PHASE;
    }
}
