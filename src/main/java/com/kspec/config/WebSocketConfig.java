package com.kspec.config;

import com.kspec.api.websocket.DaemonWebSocketHandler;
import com.kspec.api.websocket.ProjectBindingHandshakeInterceptor;
import com.kspec.protocol.FrameCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import tools.jackson.databind.ObjectMapper;

/**
 * Registers the raw event socket (no STOMP) at {@code kspec.daemon.websocket.path}, with the project
 * binding interceptor and the configured origin patterns.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final DaemonProperties daemonProperties;
    private final DaemonWebSocketHandler daemonWebSocketHandler;
    private final ProjectBindingHandshakeInterceptor projectBindingHandshakeInterceptor;

    public WebSocketConfig(
            DaemonProperties daemonProperties,
            DaemonWebSocketHandler daemonWebSocketHandler,
            ProjectBindingHandshakeInterceptor projectBindingHandshakeInterceptor) {
        this.daemonProperties = daemonProperties;
        this.daemonWebSocketHandler = daemonWebSocketHandler;
        this.projectBindingHandshakeInterceptor = projectBindingHandshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        DaemonProperties.Websocket websocket = daemonProperties.getWebsocket();
        registry.addHandler(daemonWebSocketHandler, websocket.getPath())
                .addInterceptors(projectBindingHandshakeInterceptor)
                .setAllowedOriginPatterns(websocket.getAllowedOriginPatterns().toArray(String[]::new));
    }

    /** Runs the heartbeat tick and the send watchdog; a fixed-rate task never overlaps itself. */
    @Bean("heartbeatScheduler")
    public ThreadPoolTaskScheduler heartbeatScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("ws-heartbeat-");
        scheduler.setDaemon(true);
        return scheduler;
    }

    @Bean
    public FrameCodec frameCodec(ObjectMapper objectMapper) {
        return new FrameCodec(objectMapper);
    }
}
