package com.kspec.client;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Counters shown in the dashboard's connection panel. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionStats {

    private long connectCount;
    private long reconnectCount;
    private Instant lastConnectedAt;
    private Instant lastDisconnectedAt;
    private String sessionId;
}
