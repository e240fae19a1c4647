package com.kspec.api.websocket;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one {@link TopicRegistry#broadcast} call: the shared message id and how many subscribers got
 * the event or had it skipped for backpressure.
 */
@Getter
@ToString
@AllArgsConstructor
public class BroadcastResult {

    private final String msgId;
    private final int delivered;
    private final int dropped;
}
