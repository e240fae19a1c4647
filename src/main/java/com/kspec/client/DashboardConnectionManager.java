package com.kspec.client;

import com.kspec.exception.FrameDecodingException;
import com.kspec.protocol.BroadcastEvent;
import com.kspec.protocol.CommandAck;
import com.kspec.protocol.ConnectedEvent;
import com.kspec.protocol.FrameCodec;
import com.kspec.protocol.WebSocketCommand;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.json.JsonMapper;

/**
 * Consumer side of the event socket: keeps one logical session alive across socket drops.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>drive {@link ReconnectionStateMachine} and carry out its actions (open/close sockets, backoff
 *       timers, connection-lost timer)</li>
 *   <li>remember the wanted topics and resubscribe all of them after every reconnect</li>
 *   <li>drop broadcast events whose {@code seq} is not above the last one processed on this socket</li>
 *   <li>dispatch events to per-topic handlers and notify state listeners</li>
 * </ul>
 *
 * <p>All state is confined to the {@link ClientScheduler}: public methods and transport callbacks only
 * enqueue work there. Callbacks from a socket that has since been replaced are ignored, tracked by a
 * generation number bumped on every open and close.
 */
public class DashboardConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(DashboardConnectionManager.class);

    /** Time without a connection after which the UI shows "Connection Lost". */
    public static final Duration CONNECTION_LOST_THRESHOLD = Duration.ofSeconds(10);

    static final int CLIENT_DISCONNECT_CODE = 1000;
    static final String CLIENT_DISCONNECT_REASON = "Client disconnect";

    private final URI uri;
    private final DaemonTransport transport;
    private final ClientScheduler scheduler;
    private final FrameCodec frameCodec;
    private final Clock clock;
    private final ReconnectionStateMachine stateMachine = new ReconnectionStateMachine();

    private final Set<String> subscribedTopics = ConcurrentHashMap.newKeySet();
    private final Map<String, List<Consumer<BroadcastEvent>>> handlers = new ConcurrentHashMap<>();
    private final List<StateChangeListener> listeners = new CopyOnWriteArrayList<>();

    // written on the scheduler only, volatile for readers on other threads
    private volatile ReconnectionState state = ReconnectionState.initial();
    private volatile long lastSeqProcessed = -1;
    private volatile Instant disconnectedSince;
    private volatile String sessionId;
    private volatile long connectCount;
    private volatile long reconnectCount;
    private volatile Instant lastConnectedAt;
    private volatile Instant lastDisconnectedAt;

    // scheduler only
    private TransportSession socket;
    private long socketGeneration;
    private ClientScheduler.Cancellable reconnectTimer;
    private ClientScheduler.Cancellable connectionLostTimer;

    public DashboardConnectionManager(
            URI uri, DaemonTransport transport, ClientScheduler scheduler, FrameCodec frameCodec, Clock clock) {
        this.uri = uri;
        this.transport = transport;
        this.scheduler = scheduler;
        this.frameCodec = frameCodec;
        this.clock = clock;
    }

    /** Manager over a real socket client and a dedicated scheduler thread. */
    public static DashboardConnectionManager create(URI uri) {
        return new DashboardConnectionManager(
                uri,
                new SpringWebSocketTransport(),
                new SingleThreadClientScheduler(),
                new FrameCodec(JsonMapper.builder().build()),
                Clock.systemUTC());
    }

    // ---- Lifecycle ----

    public void connect() {
        scheduler.execute(() -> apply(ClientEvent.CONNECT_REQUESTED));
    }

    /** Closes with 1000 and suppresses automatic reconnection until the next {@link #connect()}. */
    public void disconnect() {
        scheduler.execute(() -> apply(ClientEvent.DISCONNECT_REQUESTED));
    }

    /** Starts over with a fresh retry budget, also after {@link ConnectionStatus#GIVEN_UP}. */
    public void reset() {
        scheduler.execute(() -> apply(ClientEvent.RESET_REQUESTED));
    }

    // ---- Subscriptions ----

    public void subscribe(Collection<String> topics) {
        List<String> requested = List.copyOf(topics);
        scheduler.execute(() -> {
            List<String> added = requested.stream().filter(subscribedTopics::add).toList();
            if (!added.isEmpty() && state.getStatus() == ConnectionStatus.CONNECTED) {
                sendCommand(WebSocketCommand.subscribe(newRequestId(), added));
            }
        });
    }

    public void unsubscribe(Collection<String> topics) {
        List<String> requested = List.copyOf(topics);
        scheduler.execute(() -> {
            List<String> removed = requested.stream().filter(subscribedTopics::remove).toList();
            if (!removed.isEmpty() && state.getStatus() == ConnectionStatus.CONNECTED) {
                sendCommand(WebSocketCommand.unsubscribe(newRequestId(), removed));
            }
        });
    }

    /** Application-level ping; the server answers with a successful ack. */
    public void ping() {
        scheduler.execute(() -> {
            if (state.getStatus() == ConnectionStatus.CONNECTED) {
                sendCommand(WebSocketCommand.ping(newRequestId()));
            }
        });
    }

    // ---- Handlers ----

    public void on(String topic, Consumer<BroadcastEvent> handler) {
        handlers.computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void off(String topic, Consumer<BroadcastEvent> handler) {
        List<Consumer<BroadcastEvent>> topicHandlers = handlers.get(topic);
        if (topicHandlers != null) {
            topicHandlers.remove(handler);
        }
    }

    public void onStateChange(StateChangeListener listener) {
        listeners.add(listener);
    }

    // ---- State ----

    public ConnectionStatus getStatus() {
        return state.getStatus();
    }

    public int getReconnectAttempts() {
        return state.getReconnectAttempts();
    }

    public ConnectivityStatus getConnectivityStatus() {
        ConnectionStatus status = state.getStatus();
        if (status == ConnectionStatus.CONNECTED) {
            return ConnectivityStatus.CONNECTED;
        }
        Instant since = disconnectedSince;
        if (since != null && Duration.between(since, clock.instant()).compareTo(CONNECTION_LOST_THRESHOLD) >= 0) {
            return ConnectivityStatus.CONNECTION_LOST;
        }
        if (status == ConnectionStatus.CONNECTING || status == ConnectionStatus.RECONNECTING) {
            return ConnectivityStatus.RECONNECTING;
        }
        return ConnectivityStatus.DISCONNECTED;
    }

    public boolean isConnectionLost() {
        return getConnectivityStatus() == ConnectivityStatus.CONNECTION_LOST;
    }

    public long getLastSeqProcessed() {
        return lastSeqProcessed;
    }

    public Set<String> getSubscriptions() {
        return Set.copyOf(subscribedTopics);
    }

    public ConnectionStats getStats() {
        return ConnectionStats.builder()
                .connectCount(connectCount)
                .reconnectCount(reconnectCount)
                .lastConnectedAt(lastConnectedAt)
                .lastDisconnectedAt(lastDisconnectedAt)
                .sessionId(sessionId)
                .build();
    }

    // ---- State machine ----

    private void apply(ClientEvent event) {
        ConnectionStatus previous = state.getStatus();
        Transition transition = stateMachine.next(state, event);
        state = transition.getState();
        for (ClientAction action : transition.getActions()) {
            perform(action);
        }
        if (previous != state.getStatus()) {
            log.debug("Client {} -> {} on {}", previous, state.getStatus(), event);
            if (state.getStatus() == ConnectionStatus.GIVEN_UP) {
                log.error(
                        "Failed to reconnect to {} after {} attempts, giving up",
                        uri,
                        ReconnectionStateMachine.MAX_RECONNECT_ATTEMPTS);
            }
            notifyListeners();
        }
    }

    private void perform(ClientAction action) {
        switch (action.getType()) {
            case OPEN_SOCKET -> openSocket();
            case CLOSE_SOCKET -> closeSocket();
            case RESET_SEQUENCE -> lastSeqProcessed = -1;
            case RESUBSCRIBE_ALL -> resubscribeAll();
            case SCHEDULE_RECONNECT -> scheduleReconnect(action.getDelay());
            case CANCEL_RECONNECT -> cancelReconnect();
            case START_CONNECTION_LOST_TIMER -> startConnectionLostTimer();
            case CLEAR_CONNECTION_LOST_TIMER -> clearConnectionLostTimer();
        }
    }

    private void openSocket() {
        long generation = ++socketGeneration;
        log.info("Connecting to {}", uri);
        try {
            transport.open(uri, new GenerationListener(generation));
        } catch (RuntimeException e) {
            log.warn("Connect to {} failed: {}", uri, e.getMessage());
            scheduler.execute(() -> {
                if (generation == socketGeneration) {
                    apply(ClientEvent.CONNECT_FAILED);
                }
            });
        }
    }

    private void closeSocket() {
        socketGeneration++;
        TransportSession current = socket;
        socket = null;
        sessionId = null;
        if (current != null && current.isOpen()) {
            current.close(CLIENT_DISCONNECT_CODE, CLIENT_DISCONNECT_REASON);
        }
    }

    private void resubscribeAll() {
        if (subscribedTopics.isEmpty()) {
            return;
        }
        List<String> topics = List.copyOf(subscribedTopics);
        log.info("Resubscribing to {} topic(s): {}", topics.size(), topics);
        sendCommand(WebSocketCommand.subscribe(newRequestId(), topics));
    }

    private void scheduleReconnect(Duration delay) {
        cancelReconnect();
        reconnectCount++;
        log.info(
                "Reconnection attempt {}/{}, next retry in {}ms",
                state.getReconnectAttempts(),
                ReconnectionStateMachine.MAX_RECONNECT_ATTEMPTS,
                delay.toMillis());
        reconnectTimer = scheduler.schedule(() -> {
            reconnectTimer = null;
            apply(ClientEvent.RECONNECT_TIMER_FIRED);
        }, delay);
    }

    private void cancelReconnect() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    /** Starts the outage clock on the first drop only; later failed retries keep the original start. */
    private void startConnectionLostTimer() {
        if (disconnectedSince != null) {
            return;
        }
        disconnectedSince = clock.instant();
        connectionLostTimer = scheduler.schedule(() -> {
            connectionLostTimer = null;
            log.warn("No connection to {} for {}s", uri, CONNECTION_LOST_THRESHOLD.toSeconds());
            notifyListeners();
        }, CONNECTION_LOST_THRESHOLD);
    }

    private void clearConnectionLostTimer() {
        disconnectedSince = null;
        if (connectionLostTimer != null) {
            connectionLostTimer.cancel();
            connectionLostTimer = null;
        }
    }

    // ---- Frames ----

    private void handleFrame(String raw) {
        Object frame;
        try {
            frame = frameCodec.decodeServerFrame(raw);
        } catch (FrameDecodingException e) {
            log.error("Failed to parse frame from daemon: {}", e.getMessage());
            return;
        }

        if (frame instanceof ConnectedEvent connected) {
            sessionId = connected.getSessionId();
            log.info("Session established: {}", sessionId);
            apply(ClientEvent.SESSION_ESTABLISHED);
        } else if (frame instanceof CommandAck ack) {
            if (!ack.isSuccess()) {
                log.error("Command {} failed: {}", ack.getRequestId(), ack.getError());
            }
        } else if (frame instanceof BroadcastEvent event) {
            handleBroadcast(event);
        }
    }

    private void handleBroadcast(BroadcastEvent event) {
        if (event.getSeq() <= lastSeqProcessed) {
            log.debug("Skipping duplicate event seq={} (last={})", event.getSeq(), lastSeqProcessed);
            return;
        }
        lastSeqProcessed = event.getSeq();

        List<Consumer<BroadcastEvent>> topicHandlers = handlers.get(event.getTopic());
        if (topicHandlers == null) {
            return;
        }
        for (Consumer<BroadcastEvent> handler : topicHandlers) {
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                log.error("Handler for {} failed on {}: {}", event.getTopic(), event.getEvent(), e.getMessage(), e);
            }
        }
    }

    private void sendCommand(WebSocketCommand command) {
        TransportSession current = socket;
        if (current == null || !current.isOpen()) {
            log.debug("Not connected, dropping {} command", command.getAction());
            return;
        }
        try {
            current.send(frameCodec.encode(command));
        } catch (IOException e) {
            // the close callback drives reconnection and resubscription
            log.warn("Failed to send {} command: {}", command.getAction(), e.getMessage());
        }
    }

    private void notifyListeners() {
        ConnectionStatus status = state.getStatus();
        ConnectivityStatus connectivity = getConnectivityStatus();
        for (StateChangeListener listener : listeners) {
            try {
                listener.onStateChange(status, connectivity);
            } catch (RuntimeException e) {
                log.error("State listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private static String newRequestId() {
        return UUID.randomUUID().toString();
    }

    /** Forwards transport callbacks onto the scheduler, dropping those of a replaced socket. */
    private final class GenerationListener implements TransportListener {

        private final long generation;

        private GenerationListener(long generation) {
            this.generation = generation;
        }

        @Override
        public void onOpen(TransportSession session) {
            scheduler.execute(() -> {
                if (generation != socketGeneration) {
                    session.close(CLIENT_DISCONNECT_CODE, CLIENT_DISCONNECT_REASON);
                    return;
                }
                socket = session;
                connectCount++;
                lastConnectedAt = clock.instant();
                log.info("Connected to {}", uri);
                apply(ClientEvent.SOCKET_OPENED);
            });
        }

        @Override
        public void onMessage(String text) {
            scheduler.execute(() -> {
                if (generation == socketGeneration) {
                    handleFrame(text);
                }
            });
        }

        @Override
        public void onClose(int code, String reason) {
            scheduler.execute(() -> {
                if (generation != socketGeneration) {
                    return;
                }
                socket = null;
                sessionId = null;
                lastDisconnectedAt = clock.instant();
                log.warn("Disconnected from {}: {} {}", uri, code, reason);
                apply(ClientEvent.SOCKET_CLOSED);
            });
        }

        @Override
        public void onConnectFailure(Throwable cause) {
            scheduler.execute(() -> {
                if (generation != socketGeneration) {
                    return;
                }
                lastDisconnectedAt = clock.instant();
                log.warn("Connect to {} failed: {}", uri, cause.getMessage());
                apply(ClientEvent.CONNECT_FAILED);
            });
        }
    }
}
