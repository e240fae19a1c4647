package com.kspec.api.controller;

import com.kspec.api.dto.response.ConnectionInfoResponse;
import com.kspec.api.websocket.SocketConnection;
import com.kspec.api.websocket.TopicRegistry;
import com.kspec.exception.SessionNotFoundException;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of live socket connections, for debugging a dashboard that stopped receiving events.
 */
@RestController
@RequestMapping("/api/ws/connections")
public class ConnectionDebugController {

    private final TopicRegistry topicRegistry;

    public ConnectionDebugController(TopicRegistry topicRegistry) {
        this.topicRegistry = topicRegistry;
    }

    /** Oldest connection first. */
    @GetMapping
    public ResponseEntity<List<ConnectionInfoResponse>> listConnections() {
        List<ConnectionInfoResponse> connections = topicRegistry.snapshot().stream()
                .sorted(Comparator.comparing(SocketConnection::getConnectedAt))
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(connections);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<ConnectionInfoResponse> getConnection(@PathVariable String sessionId) {
        SocketConnection connection = topicRegistry
                .find(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return ResponseEntity.ok(toResponse(connection));
    }

    private ConnectionInfoResponse toResponse(SocketConnection connection) {
        return ConnectionInfoResponse.builder()
                .sessionId(connection.getSessionId())
                .projectPath(connection.getProjectPath())
                .topics(connection.getTopics())
                .outSeq(connection.getOutSeq())
                .bufferedBytes(connection.getBufferedBytes())
                .connectedAt(ConnectionInfoResponse.format(connection.getConnectedAt()))
                .lastPongReceivedAt(ConnectionInfoResponse.format(connection.getLastPongReceivedAt()))
                .build();
    }
}
