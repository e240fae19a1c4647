package com.kspec.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Daemon settings bound from the {@code kspec.daemon.*} prefix in application.properties.
 *
 * <p>Defaults match the protocol constants (30s ping, 90s pong timeout, 1 MiB backpressure threshold), so an
 * empty configuration gives the documented behaviour.
 */
@ConfigurationProperties(prefix = "kspec.daemon")
@Validated
@Getter
@Setter
public class DaemonProperties {

    /** Version reported by the health endpoint. */
    @NotBlank
    private String version = "0.1.0";

    /** Reject requests whose Host header is not a loopback name. */
    private boolean localhostOnly = true;

    @Valid
    private Websocket websocket = new Websocket();

    @Valid
    private Async async = new Async();

    @Getter
    @Setter
    public static class Websocket {

        /** Handshake path of the event socket. */
        @NotBlank
        private String path = "/ws";

        /** Origin patterns accepted on the handshake. */
        private List<String> allowedOriginPatterns = new ArrayList<>(List.of("http://localhost:*", "http://127.0.0.1:*"));

        /** How often every connection is probed with a transport ping. */
        @NotNull
        private Duration pingInterval = Duration.ofSeconds(30);

        /** Silence after the last pong beyond which a connection is closed with 1001. */
        @NotNull
        private Duration pongTimeout = Duration.ofSeconds(90);

        /** Queued outbound bytes at or above which broadcasts to that connection are dropped. */
        @Min(1)
        private long backpressureThresholdBytes = 1024 * 1024;

        /** Longest a single socket write may block before the connection is closed as unreliable. */
        @NotNull
        private Duration sendTimeLimit = Duration.ofSeconds(10);

        /** How often blocked writes are looked for. */
        @NotNull
        private Duration sendCheckInterval = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Async {

        @Min(1)
        private int corePoolSize = 2;

        @Min(1)
        private int maxPoolSize = 8;

        @Min(0)
        private int queueCapacity = 1000;
    }
}
