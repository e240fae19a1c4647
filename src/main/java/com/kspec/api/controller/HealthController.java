package com.kspec.api.controller;

import com.kspec.api.websocket.TopicRegistry;
import com.kspec.config.DaemonProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint polled by the CLI to find out whether a daemon is already running.
 *
 * <p>GET /api/health returns {@code {status, uptime, connections, version}}, uptime in seconds.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final TopicRegistry topicRegistry;
    private final DaemonProperties daemonProperties;
    private final Instant startedAt = Instant.now();

    public HealthController(TopicRegistry topicRegistry, DaemonProperties daemonProperties) {
        this.topicRegistry = topicRegistry;
        this.daemonProperties = daemonProperties;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("uptime", Duration.between(startedAt, Instant.now()).toMillis() / 1000.0);
        body.put("connections", topicRegistry.connectionCount());
        body.put("version", daemonProperties.getVersion());
        return ResponseEntity.ok(body);
    }
}
