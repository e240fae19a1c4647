package com.kspec.api.websocket;

import com.github.f4b6a3.ulid.UlidCreator;
import com.kspec.config.DaemonProperties;
import com.kspec.exception.ConnectionRegistryException;
import com.kspec.observability.WebSocketMetrics;
import com.kspec.protocol.BroadcastEvent;
import com.kspec.protocol.FrameCodec;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

/**
 * Owns every live event-socket connection and fans topic events out to subscribers.
 *
 * <p>Each broadcast gets one ULID {@code msg_id} and one timestamp, shared by all recipients, while the
 * sequence number is assigned per connection by {@link SocketConnection#offerEvent}. A subscriber whose
 * outbound buffer is at or above the configured threshold has the event skipped: its sequence counter does
 * not move, so a client seeing a gap knows it has missed nothing but what the server chose to drop.
 *
 * <p>Broadcasts iterate a snapshot of the connection map. A connection removed mid-broadcast is already
 * marked closed and refuses the frame, so no event is queued after {@link #removeConnection} returns.
 *
 * <p>A connection whose socket rejects a write is evicted from the drain thread with
 * {@link CloseStatus#SESSION_NOT_RELIABLE}.
 *
 * <p>Once {@link #shutdown} has run, new connections are refused with
 * {@link ConnectionRegistryException#registryClosed}.
 */
@Component
public class TopicRegistry {

    private static final Logger log = LoggerFactory.getLogger(TopicRegistry.class);

    private final Map<String, SocketConnection> connections = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();
    private final FrameCodec frameCodec;
    private final WebSocketMetrics webSocketMetrics;
    private final long backpressureThresholdBytes;

    private volatile boolean closed;

    public TopicRegistry(FrameCodec frameCodec, WebSocketMetrics webSocketMetrics, DaemonProperties daemonProperties) {
        this.frameCodec = frameCodec;
        this.webSocketMetrics = webSocketMetrics;
        this.backpressureThresholdBytes = daemonProperties.getWebsocket().getBackpressureThresholdBytes();
    }

    public void addConnection(SocketConnection connection) {
        String sessionId = connection.getSessionId();
        connection.onWriteFailure(this::evictUnwritable);
        synchronized (lifecycleLock) {
            if (closed) {
                throw ConnectionRegistryException.registryClosed(sessionId);
            }
            if (connections.putIfAbsent(sessionId, connection) != null) {
                throw ConnectionRegistryException.duplicateSession(sessionId);
            }
        }
        webSocketMetrics.connectionOpened();
        log.debug("Registered connection {} (project={})", sessionId, connection.getProjectPath());
    }

    /**
     * Drops a connection and its subscriptions. Idempotent.
     *
     * @return the removed connection, empty if it was not registered
     */
    public Optional<SocketConnection> removeConnection(String sessionId) {
        SocketConnection connection = connections.remove(sessionId);
        if (connection == null) {
            return Optional.empty();
        }
        connection.markClosed();
        webSocketMetrics.connectionClosed();
        log.debug("Removed connection {}", sessionId);
        return Optional.of(connection);
    }

    /** @return false if the session is not registered */
    public boolean subscribe(String sessionId, Collection<String> topics) {
        SocketConnection connection = connections.get(sessionId);
        if (connection == null) {
            return false;
        }
        connection.addTopics(topics);
        log.debug("Connection {} subscribed to {}", sessionId, topics);
        return true;
    }

    /** @return false if the session is not registered */
    public boolean unsubscribe(String sessionId, Collection<String> topics) {
        SocketConnection connection = connections.get(sessionId);
        if (connection == null) {
            return false;
        }
        connection.removeTopics(topics);
        log.debug("Connection {} unsubscribed from {}", sessionId, topics);
        return true;
    }

    public BroadcastResult broadcast(String topic, String event, Object data) {
        return broadcast(topic, event, data, null);
    }

    /**
     * Sends an event to every subscriber of {@code topic}.
     *
     * @param projectPath when non-null, only connections bound to this project receive the event
     */
    public BroadcastResult broadcast(String topic, String event, Object data, String projectPath) {
        BroadcastEvent template = BroadcastEvent.builder()
                .msgId(UlidCreator.getMonotonicUlid().toString())
                .timestamp(Instant.now().truncatedTo(ChronoUnit.MILLIS).toString())
                .topic(topic)
                .event(event)
                .data(data)
                .build();

        int delivered = 0;
        int dropped = 0;
        for (SocketConnection connection : List.copyOf(connections.values())) {
            if (!connection.isSubscribed(topic)) {
                continue;
            }
            if (projectPath != null && !projectPath.equals(connection.getProjectPath())) {
                continue;
            }

            DeliveryOutcome outcome;
            try {
                outcome = connection.offerEvent(
                        backpressureThresholdBytes, seq -> frameCodec.encode(template.withSeq(seq)));
            } catch (RuntimeException e) {
                log.error(
                        "Failed to send {} {} to {}: {}",
                        topic,
                        event,
                        connection.getSessionId(),
                        e.getMessage(),
                        e);
                continue;
            }

            if (outcome == DeliveryOutcome.DELIVERED) {
                delivered++;
            } else if (outcome == DeliveryOutcome.DROPPED) {
                dropped++;
                log.warn(
                        "Skipping {} for {}: {} bytes buffered",
                        event,
                        connection.getSessionId(),
                        connection.getBufferedBytes());
            }
        }

        webSocketMetrics.recordDelivered(delivered);
        webSocketMetrics.recordDropped(dropped);
        log.debug("Broadcast {} on {}: delivered={}, dropped={}", event, topic, delivered, dropped);
        return new BroadcastResult(template.getMsgId(), delivered, dropped);
    }

    public int connectionCount() {
        return connections.size();
    }

    public Optional<SocketConnection> find(String sessionId) {
        return Optional.ofNullable(connections.get(sessionId));
    }

    /** Point-in-time copy of the registered connections. */
    public List<SocketConnection> snapshot() {
        return List.copyOf(connections.values());
    }

    /** Session id to subscribed topics, for diagnostics. */
    public Map<String, Set<String>> subscriptionsSnapshot() {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        connections.forEach((sessionId, connection) -> result.put(sessionId, connection.getTopics()));
        return result;
    }

    /**
     * Removes a connection and closes its socket with the given status.
     *
     * @return false if the session was not registered or is already being closed
     */
    public boolean evict(String sessionId, CloseStatus status) {
        SocketConnection connection = connections.get(sessionId);
        if (connection == null || !connection.markClosing()) {
            return false;
        }
        removeConnection(sessionId);
        connection.closeSocket(status);
        log.info("Closed connection {} with {} ({})", sessionId, status.getCode(), status.getReason());
        return true;
    }

    /**
     * Stops accepting connections and closes every registered one with {@code status}.
     *
     * @return number of connections closed
     */
    public int shutdown(CloseStatus status) {
        synchronized (lifecycleLock) {
            closed = true;
        }
        int count = 0;
        for (SocketConnection connection : snapshot()) {
            if (evict(connection.getSessionId(), status)) {
                count++;
            }
        }
        return count;
    }

    private void evictUnwritable(SocketConnection connection) {
        if (evict(connection.getSessionId(), CloseStatus.SESSION_NOT_RELIABLE)) {
            webSocketMetrics.recordEviction();
        }
    }

    public boolean isClosed() {
        return closed;
    }
}
