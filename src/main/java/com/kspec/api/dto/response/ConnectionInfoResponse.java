package com.kspec.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Diagnostic view of one live socket connection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionInfoResponse {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("project_path")
    private String projectPath;

    private Set<String> topics;

    /** Sequence number the next broadcast to this connection will carry. */
    @JsonProperty("out_seq")
    private long outSeq;

    @JsonProperty("buffered_bytes")
    private long bufferedBytes;

    @JsonProperty("connected_at")
    private String connectedAt;

    @JsonProperty("last_pong_received_at")
    private String lastPongReceivedAt;

    public static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
