package com.kspec.api.websocket;

import com.kspec.config.DaemonProperties;
import com.kspec.observability.WebSocketMetrics;
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
 * Evicts connections whose current socket write has been blocked for longer than the send time limit.
 *
 * <p>Outbound drains share a fixed pool, so a peer that stops reading would otherwise hold a pool thread
 * until the heartbeat notices it. Closing the socket aborts the blocked write, which releases the thread.
 */
@Component
public class SendTimeoutWatchdog {

    private static final Logger log = LoggerFactory.getLogger(SendTimeoutWatchdog.class);

    static final CloseStatus SEND_TIMEOUT = CloseStatus.SESSION_NOT_RELIABLE.withReason("Send timeout");

    private final TopicRegistry topicRegistry;
    private final TaskScheduler heartbeatScheduler;
    private final WebSocketMetrics webSocketMetrics;
    private final Duration sendTimeLimit;
    private final Duration checkInterval;

    private ScheduledFuture<?> checkTask;

    public SendTimeoutWatchdog(
            TopicRegistry topicRegistry,
            @Qualifier("heartbeatScheduler") TaskScheduler heartbeatScheduler,
            WebSocketMetrics webSocketMetrics,
            DaemonProperties daemonProperties) {
        this.topicRegistry = topicRegistry;
        this.heartbeatScheduler = heartbeatScheduler;
        this.webSocketMetrics = webSocketMetrics;
        this.sendTimeLimit = daemonProperties.getWebsocket().getSendTimeLimit();
        this.checkInterval = daemonProperties.getWebsocket().getSendCheckInterval();
    }

    public synchronized void start() {
        if (checkTask != null) {
            return;
        }
        checkTask = heartbeatScheduler.scheduleAtFixedRate(this::check, Instant.now().plus(checkInterval), checkInterval);
        log.info("Send watchdog started: limit {}ms, checked every {}ms", sendTimeLimit.toMillis(), checkInterval.toMillis());
    }

    public synchronized void stop() {
        if (checkTask == null) {
            return;
        }
        checkTask.cancel(false);
        checkTask = null;
    }

    public synchronized boolean isRunning() {
        return checkTask != null;
    }

    public int check() {
        return check(Instant.now());
    }

    /**
     * Testable version: evicts every connection stalled as of {@code now}.
     *
     * @return number of connections evicted
     */
    public int check(Instant now) {
        int evicted = 0;
        for (SocketConnection connection : topicRegistry.snapshot()) {
            if (!connection.isWriteStalled(now, sendTimeLimit)) {
                continue;
            }
            log.warn("Write to {} blocked for over {}ms, closing", connection.getSessionId(), sendTimeLimit.toMillis());
            try {
                if (topicRegistry.evict(connection.getSessionId(), SEND_TIMEOUT)) {
                    webSocketMetrics.recordEviction();
                    evicted++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to evict {}: {}", connection.getSessionId(), e.getMessage(), e);
            }
        }
        return evicted;
    }
}
