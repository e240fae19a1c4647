package com.kspec.api.websocket;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Binds a socket to a project directory at handshake time, from the {@code X-Kspec-Dir} header or, for
 * browsers that cannot set headers on a WebSocket, the {@code project} query parameter. The header wins
 * when both are present. Unbound connections receive events for every project.
 */
@Component
public class ProjectBindingHandshakeInterceptor implements HandshakeInterceptor {

    public static final String PROJECT_HEADER = "X-Kspec-Dir";
    public static final String PROJECT_QUERY_PARAM = "project";
    public static final String PROJECT_PATH_ATTRIBUTE = "kspec.projectPath";

    @Override
    public boolean beforeHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Map<String, Object> attributes) {
        String projectPath = request.getHeaders().getFirst(PROJECT_HEADER);
        if (!StringUtils.hasText(projectPath)) {
            String raw = UriComponentsBuilder.fromUri(request.getURI())
                    .build()
                    .getQueryParams()
                    .getFirst(PROJECT_QUERY_PARAM);
            projectPath = raw != null ? UriUtils.decode(raw, StandardCharsets.UTF_8) : null;
        }
        if (StringUtils.hasText(projectPath)) {
            attributes.put(PROJECT_PATH_ATTRIBUTE, projectPath);
        }
        return true;
    }

    @Override
    public void afterHandshake(
            ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler, Exception exception) {}
}
