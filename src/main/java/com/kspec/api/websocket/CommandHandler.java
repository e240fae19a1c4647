package com.kspec.api.websocket;

import com.kspec.exception.CommandValidationException;
import com.kspec.exception.ErrorCode;
import com.kspec.exception.FrameDecodingException;
import com.kspec.observability.WebSocketMetrics;
import com.kspec.protocol.CommandAck;
import com.kspec.protocol.CommandAction;
import com.kspec.protocol.FrameCodec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses inbound client frames and answers each with exactly one ack on the same connection.
 *
 * <p>Malformed input never closes the socket. The ack's {@code request_id} echoes the command's when it is
 * a string, and is omitted otherwise.
 */
@Component
public class CommandHandler {

    private static final Logger log = LoggerFactory.getLogger(CommandHandler.class);

    public static final String INVALID_PAYLOAD = "validation_error: invalid payload";
    public static final String INVALID_ACTION = "missing or invalid action field";
    public static final String INVALID_TOPICS = "validation_error: missing or invalid topics array";
    public static final String SESSION_NOT_FOUND = "not_found: session not found";

    private final TopicRegistry topicRegistry;
    private final FrameCodec frameCodec;
    private final WebSocketMetrics webSocketMetrics;

    public CommandHandler(TopicRegistry topicRegistry, FrameCodec frameCodec, WebSocketMetrics webSocketMetrics) {
        this.topicRegistry = topicRegistry;
        this.frameCodec = frameCodec;
        this.webSocketMetrics = webSocketMetrics;
    }

    public void handleMessage(SocketConnection connection, String rawMessage) {
        Map<String, Object> envelope;
        try {
            envelope = frameCodec.decodeObject(rawMessage);
        } catch (FrameDecodingException e) {
            log.warn("Unparseable frame from {}: {}", connection.getSessionId(), e.getMessage());
            reply(connection, CommandAck.failure(null, INVALID_PAYLOAD));
            return;
        }

        String requestId = envelope.get("request_id") instanceof String id ? id : null;
        try {
            CommandAction action = parseAction(envelope);
            switch (action) {
                case SUBSCRIBE -> handleSubscribe(connection, requestId, parseTopics(envelope));
                case UNSUBSCRIBE -> handleUnsubscribe(connection, requestId, parseTopics(envelope));
                case PING -> reply(connection, CommandAck.ok(requestId));
            }
        } catch (CommandValidationException e) {
            log.warn("Rejected command from {}: {}", connection.getSessionId(), e.getMessage());
            reply(connection, CommandAck.failure(requestId, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Command from {} failed: {}", connection.getSessionId(), e.getMessage(), e);
            reply(connection, CommandAck.failure(requestId, "internal_error: " + e.getMessage()));
        }
    }

    private void handleSubscribe(SocketConnection connection, String requestId, List<String> topics) {
        if (!topicRegistry.subscribe(connection.getSessionId(), topics)) {
            reply(connection, CommandAck.failure(requestId, SESSION_NOT_FOUND));
            return;
        }
        log.debug("Client {} subscribed to {}", connection.getSessionId(), topics);
        reply(connection, CommandAck.ok(requestId));
    }

    private void handleUnsubscribe(SocketConnection connection, String requestId, List<String> topics) {
        if (!topicRegistry.unsubscribe(connection.getSessionId(), topics)) {
            reply(connection, CommandAck.failure(requestId, SESSION_NOT_FOUND));
            return;
        }
        log.debug("Client {} unsubscribed from {}", connection.getSessionId(), topics);
        reply(connection, CommandAck.ok(requestId));
    }

    private CommandAction parseAction(Map<String, Object> envelope) {
        Object action = envelope.get("action");
        if (!(action instanceof String wireValue)) {
            throw new CommandValidationException(ErrorCode.INVALID_ACTION, INVALID_ACTION);
        }
        return CommandAction.fromWireValue(wireValue)
                .orElseThrow(() -> new CommandValidationException(ErrorCode.INVALID_ACTION, INVALID_ACTION));
    }

    private List<String> parseTopics(Map<String, Object> envelope) {
        if (!(envelope.get("payload") instanceof Map<?, ?> payload)
                || !(payload.get("topics") instanceof List<?> rawTopics)
                || rawTopics.isEmpty()) {
            throw new CommandValidationException(ErrorCode.VALIDATION_ERROR, INVALID_TOPICS);
        }
        List<String> topics = new ArrayList<>(rawTopics.size());
        for (Object topic : rawTopics) {
            if (!(topic instanceof String name)) {
                throw new CommandValidationException(ErrorCode.VALIDATION_ERROR, INVALID_TOPICS);
            }
            topics.add(name);
        }
        return topics;
    }

    private void reply(SocketConnection connection, CommandAck ack) {
        if (!ack.isSuccess()) {
            webSocketMetrics.recordFailedCommand();
        }
        connection.send(frameCodec.encode(ack));
    }
}
