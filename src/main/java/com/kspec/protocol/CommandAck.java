package com.kspec.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reply to a {@link WebSocketCommand}.
 *
 * <p>{@code request_id} echoes the command's token and is omitted when the command carried none
 * (or could not be parsed). {@code error} is present only on failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CommandAck {

    @Builder.Default
    private boolean ack = true;

    @JsonProperty("request_id")
    private String requestId;

    private boolean success;

    private String error;

    public static CommandAck ok(String requestId) {
        return new CommandAck(true, requestId, true, null);
    }

    public static CommandAck failure(String requestId, String error) {
        return new CommandAck(true, requestId, false, error);
    }
}
