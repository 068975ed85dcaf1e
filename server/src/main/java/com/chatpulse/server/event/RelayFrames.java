package com.chatpulse.server.event;

import com.chatpulse.server.exception.InvalidControlFrameException;
import com.chatpulse.server.exception.RelayException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * JSON framing for the relay socket: every frame is {@code {"event": name, "data": payload}}.
 */
@Component
public class RelayFrames {

    private final ObjectMapper mapper;
    private final Clock clock;

    public RelayFrames(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    /** ISO-8601 UTC timestamp stamped on outgoing envelopes. */
    public String now() {
        return Instant.now(clock).toString();
    }

    public String encode(String event, Object data) {
        try {
            return mapper.writeValueAsString(new Frame(event, data));
        } catch (JsonProcessingException e) {
            throw new RelayException("cannot encode frame " + event, e);
        }
    }

    /**
     * Object payloads get a {@code timestamp} field added; anything else is wrapped as {@code {data, timestamp}}.
     */
    public ObjectNode withTimestamp(Object payload, String timestamp) {
        JsonNode tree = mapper.valueToTree(payload);
        ObjectNode out;
        if (tree != null && tree.isObject()) {
            out = ((ObjectNode) tree).deepCopy();
        } else {
            out = mapper.createObjectNode();
            out.set("data", tree);
        }
        out.put("timestamp", timestamp);
        return out;
    }

    public ClientFrame decode(String text) {
        ClientFrame frame;
        try {
            frame = mapper.readValue(text, ClientFrame.class);
        } catch (JsonProcessingException e) {
            throw new InvalidControlFrameException(null, "invalid json", e);
        }
        if (frame == null || frame.event == null || frame.event.isBlank()) {
            throw new InvalidControlFrameException(null, "missing event name");
        }
        return frame;
    }

    public static class Frame {
        public final String event;
        public final Object data;

        public Frame(String event, Object data) {
            this.event = event;
            this.data = data;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClientFrame {
        public String event;
        public JsonNode data;
    }
}
