package com.kspec.client;

import java.io.IOException;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * {@link DaemonTransport} over Spring's {@link StandardWebSocketClient}. Transport pings from the daemon
 * are answered by the container.
 */
public class SpringWebSocketTransport implements DaemonTransport {

    private static final Logger log = LoggerFactory.getLogger(SpringWebSocketTransport.class);

    private final WebSocketClient webSocketClient;
    private final WebSocketHttpHeaders headers;

    public SpringWebSocketTransport() {
        this(new StandardWebSocketClient(), new WebSocketHttpHeaders());
    }

    public SpringWebSocketTransport(WebSocketClient webSocketClient, WebSocketHttpHeaders headers) {
        this.webSocketClient = webSocketClient;
        this.headers = headers;
    }

    /** Transport that binds every socket to {@code projectPath} via the {@code X-Kspec-Dir} header. */
    public static SpringWebSocketTransport forProject(String projectPath) {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add("X-Kspec-Dir", projectPath);
        return new SpringWebSocketTransport(new StandardWebSocketClient(), headers);
    }

    @Override
    public void open(URI uri, TransportListener listener) {
        webSocketClient
                .execute(new ListenerAdapter(listener), headers, uri)
                .whenComplete((session, failure) -> {
                    if (failure != null) {
                        listener.onConnectFailure(failure);
                    }
                });
    }

    private static final class ListenerAdapter extends TextWebSocketHandler {

        private final TransportListener listener;

        private ListenerAdapter(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            listener.onOpen(new SessionAdapter(session));
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            listener.onMessage(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            // the close callback follows and drives reconnection
            log.warn("Transport error on daemon socket: {}", exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            listener.onClose(status.getCode(), status.getReason());
        }
    }

    private static final class SessionAdapter implements TransportSession {

        private final WebSocketSession session;

        private SessionAdapter(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void send(String text) throws IOException {
            session.sendMessage(new TextMessage(text));
        }

        @Override
        public void close(int code, String reason) {
            try {
                session.close(new CloseStatus(code, reason));
            } catch (IOException e) {
                log.debug("Close of daemon socket failed: {}", e.getMessage());
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }
    }
}
