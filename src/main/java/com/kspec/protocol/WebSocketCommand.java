package com.kspec.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound command frame: {@code {"action", "request_id"?, "payload"?{"topics"}}}.
 *
 * <p>The server never binds raw frames straight onto this type because it must tell apart
 * "not JSON", "missing action" and "bad topics". It is what the client sends.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebSocketCommand {

    private CommandAction action;

    @JsonProperty("request_id")
    private String requestId;

    private Payload payload;

    public static WebSocketCommand subscribe(String requestId, List<String> topics) {
        return new WebSocketCommand(CommandAction.SUBSCRIBE, requestId, new Payload(topics));
    }

    public static WebSocketCommand unsubscribe(String requestId, List<String> topics) {
        return new WebSocketCommand(CommandAction.UNSUBSCRIBE, requestId, new Payload(topics));
    }

    public static WebSocketCommand ping(String requestId) {
        return new WebSocketCommand(CommandAction.PING, requestId, null);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {

        private List<String> topics;
    }
}
