package com.kspec.protocol;

import com.kspec.exception.FrameDecodingException;
import java.util.Map;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * JSON encoding and decoding of socket frames, shared by the daemon and the client.
 *
 * <p>Decoding is deliberately loose at the first step (any JSON object) so callers can report which part
 * of a frame is wrong instead of failing on the first type mismatch.
 */
public class FrameCodec {

    private final ObjectMapper objectMapper;

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(Object frame) {
        return objectMapper.writeValueAsString(frame);
    }

    /**
     * Parses a raw frame into a JSON object.
     *
     * @throws FrameDecodingException if the text is not JSON or not a JSON object
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> decodeObject(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new FrameDecodingException("Empty frame");
        }
        Object value;
        try {
            value = objectMapper.readValue(raw, Object.class);
        } catch (JacksonException e) {
            throw new FrameDecodingException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (!(value instanceof Map)) {
            throw new FrameDecodingException("Frame is not a JSON object");
        }
        return (Map<String, Object>) value;
    }

    /**
     * Decodes a server-to-client frame into {@link ConnectedEvent}, {@link CommandAck} or
     * {@link BroadcastEvent}.
     *
     * @throws FrameDecodingException if the frame matches none of them
     */
    public Object decodeServerFrame(String raw) {
        Map<String, Object> frame = decodeObject(raw);
        if (frame.containsKey("ack")) {
            return convert(frame, CommandAck.class);
        }
        if (frame.containsKey("msg_id") && frame.containsKey("seq")) {
            return convert(frame, BroadcastEvent.class);
        }
        if (ConnectedEvent.EVENT_NAME.equals(frame.get("event"))) {
            return convert(frame, ConnectedEvent.class);
        }
        throw new FrameDecodingException("Unrecognised frame with keys " + frame.keySet());
    }

    private <T> T convert(Map<String, Object> frame, Class<T> type) {
        try {
            return objectMapper.convertValue(frame, type);
        } catch (JacksonException | IllegalArgumentException e) {
            throw new FrameDecodingException("Malformed " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
