package com.kspec.api.websocket;

import com.kspec.config.DaemonProperties;
import com.kspec.observability.WebSocketMetrics;
import com.kspec.protocol.CloseCodes;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

/**
 * Probes every connection with a transport-level ping and evicts connections that stopped answering.
 *
 * <p>Each tick first closes, with 1001, every connection whose last pong (or accept time, if it never
 * answered) is older than the pong timeout, then pings the survivors. A connection is therefore closed at
 * the first tick after the timeout elapses.
 *
 * <p>All access to connections goes through {@link TopicRegistry#snapshot()}, {@link TopicRegistry#find}
 * and {@link TopicRegistry#evict}.
 */
@Component
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    static final CloseStatus PING_TIMEOUT = new CloseStatus(CloseCodes.GOING_AWAY, "Ping timeout");

    private final TopicRegistry topicRegistry;
    private final TaskScheduler heartbeatScheduler;
    private final WebSocketMetrics webSocketMetrics;
    private final Duration pingInterval;
    private final Duration pongTimeout;

    private ScheduledFuture<?> pingTask;

    public HeartbeatManager(
            TopicRegistry topicRegistry,
            @Qualifier("heartbeatScheduler") TaskScheduler heartbeatScheduler,
            WebSocketMetrics webSocketMetrics,
            DaemonProperties daemonProperties) {
        this.topicRegistry = topicRegistry;
        this.heartbeatScheduler = heartbeatScheduler;
        this.webSocketMetrics = webSocketMetrics;
        this.pingInterval = daemonProperties.getWebsocket().getPingInterval();
        this.pongTimeout = daemonProperties.getWebsocket().getPongTimeout();
    }

    /** Schedules the periodic tick. No-op if already running. */
    public synchronized void start() {
        if (pingTask != null) {
            return;
        }
        pingTask = heartbeatScheduler.scheduleAtFixedRate(this::tick, Instant.now().plus(pingInterval), pingInterval);
        log.info("Heartbeat started: ping every {}s, timeout {}s", pingInterval.toSeconds(), pongTimeout.toSeconds());
    }

    /** Cancels the periodic tick. Idempotent. */
    public synchronized void stop() {
        if (pingTask == null) {
            return;
        }
        pingTask.cancel(false);
        pingTask = null;
        log.info("Heartbeat stopped");
    }

    public synchronized boolean isRunning() {
        return pingTask != null;
    }

    public void tick() {
        tick(Instant.now());
    }

    /**
     * Testable version: runs one heartbeat pass as of {@code now}.
     */
    public void tick(Instant now) {
        for (SocketConnection connection : topicRegistry.snapshot()) {
            try {
                checkConnection(connection, now);
            } catch (RuntimeException e) {
                // keep the scheduled task alive for the remaining connections
                log.error("Heartbeat failed for {}: {}", connection.getSessionId(), e.getMessage(), e);
            }
        }
    }

    public void recordPong(String sessionId) {
        recordPong(sessionId, Instant.now());
    }

    public void recordPong(String sessionId, Instant now) {
        topicRegistry.find(sessionId).ifPresent(connection -> connection.recordPong(now));
    }

    private void checkConnection(SocketConnection connection, Instant now) {
        Duration silence = Duration.between(connection.getLastPongReceivedAt(), now);
        if (silence.compareTo(pongTimeout) > 0) {
            log.warn("No pong from {} for {}s, closing", connection.getSessionId(), silence.toSeconds());
            if (topicRegistry.evict(connection.getSessionId(), PING_TIMEOUT)) {
                webSocketMetrics.recordEviction();
            }
            return;
        }
        connection.ping(now);
    }
}
