package com.kspec.api.websocket;

import com.github.f4b6a3.ulid.UlidCreator;
import com.kspec.exception.ConnectionRegistryException;
import com.kspec.protocol.CloseCodes;
import com.kspec.protocol.ConnectedEvent;
import com.kspec.protocol.FrameCodec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Entry point of the event socket: registers each accepted socket, greets it with its session id, routes
 * its frames to {@link CommandHandler} and its pongs to {@link HeartbeatManager}, and unregisters it on
 * close.
 */
@Component
public class DaemonWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(DaemonWebSocketHandler.class);

    static final String CONNECTION_ATTRIBUTE = "kspec.connection";
    static final CloseStatus SHUTTING_DOWN = new CloseStatus(CloseCodes.GOING_AWAY, "Server shutting down");

    private final TopicRegistry topicRegistry;
    private final CommandHandler commandHandler;
    private final HeartbeatManager heartbeatManager;
    private final FrameCodec frameCodec;
    private final Executor outboundExecutor;

    public DaemonWebSocketHandler(
            TopicRegistry topicRegistry,
            CommandHandler commandHandler,
            HeartbeatManager heartbeatManager,
            FrameCodec frameCodec,
            @Qualifier("outboundExecutor") Executor outboundExecutor) {
        this.topicRegistry = topicRegistry;
        this.commandHandler = commandHandler;
        this.heartbeatManager = heartbeatManager;
        this.frameCodec = frameCodec;
        this.outboundExecutor = outboundExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        String sessionId = UlidCreator.getMonotonicUlid().toString();
        String projectPath = (String) session.getAttributes().get(ProjectBindingHandshakeInterceptor.PROJECT_PATH_ATTRIBUTE);
        SocketConnection connection =
                new SocketConnection(sessionId, session, projectPath, Instant.now(), outboundExecutor);

        try {
            topicRegistry.addConnection(connection);
        } catch (ConnectionRegistryException e) {
            log.warn("Refusing connection: {}", e.getMessage());
            session.close(SHUTTING_DOWN);
            return;
        }

        session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
        connection.send(frameCodec.encode(ConnectedEvent.of(sessionId)));
        connection.markOpen();
        log.info(
                "WebSocket client connected: {} from {} ({} active)",
                sessionId,
                session.getRemoteAddress(),
                topicRegistry.connectionCount());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        dispatch(session, message.getPayload());
    }

    /** Binary frames are read as UTF-8 text; the default handler would close the socket instead. */
    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        dispatch(session, StandardCharsets.UTF_8.decode(message.getPayload()).toString());
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        SocketConnection connection = connectionOf(session);
        if (connection != null) {
            heartbeatManager.recordPong(connection.getSessionId());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws IOException {
        SocketConnection connection = connectionOf(session);
        log.warn(
                "Transport error on {}: {}",
                connection != null ? connection.getSessionId() : session.getId(),
                exception.getMessage());
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        SocketConnection connection = connectionOf(session);
        if (connection == null) {
            return;
        }
        topicRegistry.removeConnection(connection.getSessionId());
        log.info(
                "WebSocket client disconnected: {} ({} {}), {} active",
                connection.getSessionId(),
                status.getCode(),
                status.getReason(),
                topicRegistry.connectionCount());
    }

    private void dispatch(WebSocketSession session, String payload) {
        SocketConnection connection = connectionOf(session);
        if (connection == null || connection.getState() != ConnectionState.OPEN) {
            log.debug("Ignoring frame on unregistered or closing session {}", session.getId());
            return;
        }
        commandHandler.handleMessage(connection, payload);
    }

    private SocketConnection connectionOf(WebSocketSession session) {
        return (SocketConnection) session.getAttributes().get(CONNECTION_ATTRIBUTE);
    }
}
