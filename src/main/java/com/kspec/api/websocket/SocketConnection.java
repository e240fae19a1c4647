package com.kspec.api.websocket;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.LongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * Server-side state of one event-socket client.
 *
 * <p>Every outbound frame (connected event, acks, broadcasts, pings) goes through a single FIFO queue that
 * is drained by at most one task at a time on the outbound executor. That gives two properties:
 * <ul>
 *   <li>frames reach the socket in the order they were queued, so sequence numbers arrive ascending</li>
 *   <li>{@link #getBufferedBytes()} is the amount of data accepted but not yet written, which is what the
 *       backpressure check reads</li>
 * </ul>
 *
 * <p>The sequence counter, the closed check and the enqueue of a broadcast happen under one lock, so two
 * concurrent broadcasts can never put sequence numbers on the wire out of order, and nothing is queued
 * once {@link #markClosed()} has returned.
 *
 * <p>A frame the socket cannot take ends the connection: the rest of the queue is discarded, the socket is
 * closed with {@link CloseStatus#SESSION_NOT_RELIABLE} and the write-failure listener is told, so a broken
 * peer releases its drain thread after one failed write. A write that blocks instead of failing is visible
 * through {@link #isWriteStalled} for {@link SendTimeoutWatchdog}.
 */
public class SocketConnection {

    private static final Logger log = LoggerFactory.getLogger(SocketConnection.class);

    private final String sessionId;
    private final WebSocketSession session;
    private final String projectPath;
    private final Instant connectedAt;
    private final Executor outboundExecutor;

    private final Set<String> topics = ConcurrentHashMap.newKeySet();
    private final Object lock = new Object();
    private final Queue<WebSocketMessage<?>> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicLong bufferedBytes = new AtomicLong();
    private final AtomicBoolean draining = new AtomicBoolean();

    // guarded by lock
    private long outSeq;

    private volatile ConnectionState state = ConnectionState.OPENING;
    private volatile Instant lastPingSentAt;
    private volatile Instant lastPongReceivedAt;
    private volatile Instant writeStartedAt;
    private volatile Consumer<SocketConnection> writeFailureListener = failed -> {};

    public SocketConnection(
            String sessionId,
            WebSocketSession session,
            String projectPath,
            Instant connectedAt,
            Executor outboundExecutor) {
        this.sessionId = sessionId;
        this.session = session;
        this.projectPath = projectPath;
        this.connectedAt = connectedAt;
        this.outboundExecutor = outboundExecutor;
        this.lastPongReceivedAt = connectedAt;
    }

    /**
     * Queues one broadcast frame unless the connection is closed or its buffer is saturated.
     *
     * @param thresholdBytes buffered bytes at or above which the event is dropped
     * @param frameForSeq builds the frame text for the sequence number this connection assigns
     */
    public DeliveryOutcome offerEvent(long thresholdBytes, LongFunction<String> frameForSeq) {
        synchronized (lock) {
            if (!isAcceptingFrames()) {
                return DeliveryOutcome.CLOSED;
            }
            if (bufferedBytes.get() >= thresholdBytes) {
                return DeliveryOutcome.DROPPED;
            }
            String frame = frameForSeq.apply(outSeq);
            enqueue(new TextMessage(frame));
            outSeq++;
            return DeliveryOutcome.DELIVERED;
        }
    }

    /** Queues a control frame (connected event or ack). Not subject to backpressure. */
    public boolean send(String frame) {
        synchronized (lock) {
            if (!isAcceptingFrames()) {
                return false;
            }
            enqueue(new TextMessage(frame));
            return true;
        }
    }

    /** Queues a transport-level ping and records when it was sent. */
    public boolean ping(Instant now) {
        synchronized (lock) {
            if (!isAcceptingFrames()) {
                return false;
            }
            enqueue(new PingMessage());
            lastPingSentAt = now;
            return true;
        }
    }

    /** Called from the drain thread, at most once per failed write, before the socket is closed. */
    public void onWriteFailure(Consumer<SocketConnection> listener) {
        this.writeFailureListener = listener;
    }

    /** True while a single socket write has been in progress for longer than {@code sendTimeLimit}. */
    public boolean isWriteStalled(Instant now, Duration sendTimeLimit) {
        Instant started = writeStartedAt;
        return started != null && Duration.between(started, now).compareTo(sendTimeLimit) > 0;
    }

    public void recordPong(Instant now) {
        lastPongReceivedAt = now;
    }

    public void markOpen() {
        synchronized (lock) {
            if (state == ConnectionState.OPENING) {
                state = ConnectionState.OPEN;
            }
        }
    }

    /** @return false if the connection was already closing or closed */
    public boolean markClosing() {
        synchronized (lock) {
            if (state == ConnectionState.CLOSING || state == ConnectionState.CLOSED) {
                return false;
            }
            state = ConnectionState.CLOSING;
            return true;
        }
    }

    /** Final state. Pending outbound frames are discarded. */
    public void markClosed() {
        synchronized (lock) {
            state = ConnectionState.CLOSED;
            WebSocketMessage<?> pending;
            while ((pending = outbound.poll()) != null) {
                bufferedBytes.addAndGet(-pending.getPayloadLength());
            }
        }
    }

    /** Closes the underlying socket. Safe to call on a socket the peer has already closed. */
    public void closeSocket(CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Close of {} failed: {}", sessionId, e.getMessage());
        }
    }

    public void addTopics(Collection<String> newTopics) {
        topics.addAll(newTopics);
    }

    public void removeTopics(Collection<String> oldTopics) {
        topics.removeAll(oldTopics);
    }

    public boolean isSubscribed(String topic) {
        return topics.contains(topic);
    }

    public Set<String> getTopics() {
        return Set.copyOf(topics);
    }

    /** Sequence number the next delivered broadcast will carry. */
    public long getOutSeq() {
        synchronized (lock) {
            return outSeq;
        }
    }

    public long getBufferedBytes() {
        return bufferedBytes.get();
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getProjectPath() {
        return projectPath;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public ConnectionState getState() {
        return state;
    }

    public Instant getLastPingSentAt() {
        return lastPingSentAt;
    }

    public Instant getLastPongReceivedAt() {
        return lastPongReceivedAt;
    }

    private boolean isAcceptingFrames() {
        return state == ConnectionState.OPENING || state == ConnectionState.OPEN;
    }

    private void enqueue(WebSocketMessage<?> message) {
        outbound.add(message);
        bufferedBytes.addAndGet(message.getPayloadLength());
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            outboundExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Outbound executor rejected drain for {}: {}", sessionId, e.getMessage());
        }
    }

    private void drain() {
        do {
            WebSocketMessage<?> message;
            while ((message = outbound.poll()) != null) {
                boolean written;
                try {
                    written = write(message);
                } finally {
                    bufferedBytes.addAndGet(-message.getPayloadLength());
                }
                if (!written) {
                    abandon();
                    return;
                }
            }
            draining.set(false);
        } while (!outbound.isEmpty() && draining.compareAndSet(false, true));
    }

    /** @return false if the socket is gone or rejected the frame */
    private boolean write(WebSocketMessage<?> message) {
        if (!session.isOpen()) {
            log.debug("Socket of {} already closed, discarding outbound frames", sessionId);
            return false;
        }
        writeStartedAt = Instant.now();
        try {
            session.sendMessage(message);
            return true;
        } catch (IOException | IllegalStateException e) {
            log.warn("Write to {} failed, closing connection: {}", sessionId, e.getMessage());
            return false;
        } finally {
            writeStartedAt = null;
        }
    }

    private void abandon() {
        try {
            writeFailureListener.accept(this);
        } catch (RuntimeException e) {
            log.error("Write-failure listener for {} failed: {}", sessionId, e.getMessage(), e);
        }
        markClosed();
        closeSocket(CloseStatus.SESSION_NOT_RELIABLE);
    }
}
