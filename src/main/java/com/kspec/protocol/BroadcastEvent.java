package com.kspec.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A topic event as delivered to one connection.
 *
 * <p>{@code msg_id}, {@code timestamp}, {@code topic}, {@code event} and {@code data} are fixed once per
 * logical event and shared by every recipient. {@code seq} is stamped per connection at send time, so the
 * same logical event carries different sequence numbers on different sockets.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BroadcastEvent {

    @JsonProperty("msg_id")
    private String msgId;

    private long seq;

    /** ISO-8601 instant in UTC. */
    private String timestamp;

    private String topic;

    private String event;

    private Object data;

    public BroadcastEvent withSeq(long seq) {
        return toBuilder().seq(seq).build();
    }
}
