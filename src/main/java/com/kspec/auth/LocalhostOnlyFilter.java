package com.kspec.auth;

import com.kspec.api.dto.response.ApiErrorResponse;
import com.kspec.config.DaemonProperties;
import com.kspec.exception.ErrorCode;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import tools.jackson.databind.ObjectMapper;

/**
 * Rejects requests whose {@code Host} header does not name the loopback interface.
 *
 * <p>The daemon binds to localhost, but a browser can still be pointed at it through a DNS-rebinding
 * hostname. Checking the Host header closes that hole for both the REST API and the socket handshake.
 * Accepted hosts are {@code localhost}, {@code 127.0.0.1} and {@code [::1]}, each with or without a port.
 *
 * <p>Registered as a servlet filter via {@link com.kspec.config.WebConfig}.
 */
@Component
public class LocalhostOnlyFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(LocalhostOnlyFilter.class);
    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "::1");

    private final DaemonProperties daemonProperties;
    private final ObjectMapper objectMapper;

    public LocalhostOnlyFilter(DaemonProperties daemonProperties, ObjectMapper objectMapper) {
        this.daemonProperties = daemonProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !daemonProperties.isLocalhostOnly();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String host = request.getHeader("Host");
        String hostname = extractHostname(host);

        if (hostname == null || !LOOPBACK_HOSTS.contains(hostname)) {
            log.warn("Rejected request to {} with Host {}", request.getRequestURI(), host);
            writeForbidden(response, request.getRequestURI());
            return;
        }
        filterChain.doFilter(request, response);
    }

    /** Hostname part of a Host header: brackets stripped for IPv6, port dropped. */
    private static String extractHostname(String host) {
        if (host == null || host.isBlank()) {
            return null;
        }
        if (host.startsWith("[")) {
            int end = host.indexOf(']');
            return end > 0 ? host.substring(1, end) : null;
        }
        int colon = host.indexOf(':');
        return colon >= 0 ? host.substring(0, colon) : host;
    }

    private void writeForbidden(HttpServletResponse response, String path) throws IOException {
        ApiErrorResponse errorResponse = ApiErrorResponse.localhostOnly(path);
        response.setStatus(ErrorCode.FORBIDDEN.getHttpStatus());
        response.setContentType("application/json");
        objectMapper.writeValue(response.getOutputStream(), errorResponse);
    }
}
