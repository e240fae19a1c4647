package com.kspec.unit.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kspec.exception.FrameDecodingException;
import com.kspec.protocol.BroadcastEvent;
import com.kspec.protocol.CommandAck;
import com.kspec.protocol.CommandAction;
import com.kspec.protocol.ConnectedEvent;
import com.kspec.protocol.FrameCodec;
import com.kspec.protocol.WebSocketCommand;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

class FrameCodecTest {

    private final FrameCodec frameCodec = new FrameCodec(JsonMapper.builder().build());

    @Nested
    @DisplayName("Encoding")
    class Encoding {

        @Test
        @DisplayName("successful ack omits request_id and error when absent")
        void ackOmitsNulls() {
            Map<String, Object> frame = frameCodec.decodeObject(frameCodec.encode(CommandAck.ok(null)));

            assertThat(frame).containsOnlyKeys("ack", "success");
            assertThat(frame).containsEntry("ack", true).containsEntry("success", true);
        }

        @Test
        @DisplayName("failed ack carries request_id and error")
        void failedAck() {
            Map<String, Object> frame =
                    frameCodec.decodeObject(frameCodec.encode(CommandAck.failure("r1", "bad topics")));

            assertThat(frame)
                    .containsEntry("request_id", "r1")
                    .containsEntry("success", false)
                    .containsEntry("error", "bad topics");
        }

        @Test
        @DisplayName("broadcast uses snake_case msg_id")
        void broadcastFieldNames() {
            BroadcastEvent event = BroadcastEvent.builder()
                    .msgId("01JMSG")
                    .seq(7)
                    .timestamp("2026-01-15T10:00:00.000Z")
                    .topic("tasks:updates")
                    .event("task_updated")
                    .data(Map.of("ref", "@t"))
                    .build();

            Map<String, Object> frame = frameCodec.decodeObject(frameCodec.encode(event));

            assertThat(frame)
                    .containsOnlyKeys("msg_id", "seq", "timestamp", "topic", "event", "data")
                    .containsEntry("msg_id", "01JMSG")
                    .containsEntry("seq", 7);
        }

        @Test
        @DisplayName("commands use wire action names")
        void commandWireNames() {
            String json = frameCodec.encode(WebSocketCommand.subscribe("r1", List.of("tasks:updates")));

            assertThat(frameCodec.decodeObject(json))
                    .containsEntry("action", "subscribe")
                    .containsEntry("request_id", "r1")
                    .containsEntry("payload", Map.of("topics", List.of("tasks:updates")));
            assertThat(frameCodec.decodeObject(frameCodec.encode(WebSocketCommand.ping(null))))
                    .containsOnlyKeys("action");
        }

        @Test
        @DisplayName("withSeq keeps every other field")
        void withSeq() {
            BroadcastEvent template =
                    BroadcastEvent.builder().msgId("01J").topic("t").event("e").build();

            BroadcastEvent stamped = template.withSeq(3);

            assertThat(stamped.getSeq()).isEqualTo(3);
            assertThat(stamped.getMsgId()).isEqualTo("01J");
            assertThat(template.getSeq()).isZero();
        }
    }

    @Nested
    @DisplayName("Decoding server frames")
    class Decoding {

        @Test
        @DisplayName("connected event")
        void connected() {
            Object frame = frameCodec.decodeServerFrame("{\"event\":\"connected\",\"session_id\":\"01JS\"}");

            assertThat(frame).isInstanceOf(ConnectedEvent.class);
            assertThat(((ConnectedEvent) frame).getSessionId()).isEqualTo("01JS");
        }

        @Test
        @DisplayName("ack")
        void ack() {
            Object frame = frameCodec.decodeServerFrame(
                    "{\"ack\":true,\"request_id\":\"r\",\"success\":false,\"error\":\"nope\"}");

            assertThat(frame).isInstanceOf(CommandAck.class);
            assertThat(((CommandAck) frame).getError()).isEqualTo("nope");
        }

        @Test
        @DisplayName("broadcast event with an unknown extra field")
        void broadcast() {
            Object frame = frameCodec.decodeServerFrame("{\"msg_id\":\"01J\",\"seq\":4,\"timestamp\":\"t\","
                    + "\"topic\":\"inbox:updates\",\"event\":\"inbox_item_created\",\"data\":{\"ulid\":\"x\"},"
                    + "\"extra\":1}");

            assertThat(frame).isInstanceOf(BroadcastEvent.class);
            BroadcastEvent event = (BroadcastEvent) frame;
            assertThat(event.getSeq()).isEqualTo(4);
            assertThat(event.getData()).isEqualTo(Map.of("ulid", "x"));
        }

        @Test
        @DisplayName("rejects unknown shapes, non-objects and garbage")
        void rejects() {
            assertThatThrownBy(() -> frameCodec.decodeServerFrame("{\"hello\":1}"))
                    .isInstanceOf(FrameDecodingException.class);
            assertThatThrownBy(() -> frameCodec.decodeServerFrame("\"text\""))
                    .isInstanceOf(FrameDecodingException.class);
            assertThatThrownBy(() -> frameCodec.decodeServerFrame("{oops"))
                    .isInstanceOf(FrameDecodingException.class);
            assertThatThrownBy(() -> frameCodec.decodeServerFrame(""))
                    .isInstanceOf(FrameDecodingException.class);
        }
    }

    @Test
    @DisplayName("command actions parse from wire values only")
    void commandActionWireValues() {
        assertThat(CommandAction.fromWireValue("unsubscribe")).contains(CommandAction.UNSUBSCRIBE);
        assertThat(CommandAction.fromWireValue("SUBSCRIBE")).isEmpty();
        assertThat(CommandAction.fromWireValue(null)).isEmpty();
    }
}
