package com.kspec.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * First frame on every accepted socket: {@code {"event":"connected","session_id":"..."}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConnectedEvent {

    public static final String EVENT_NAME = "connected";

    private String event = EVENT_NAME;

    @JsonProperty("session_id")
    private String sessionId;

    public static ConnectedEvent of(String sessionId) {
        return new ConnectedEvent(EVENT_NAME, sessionId);
    }
}
