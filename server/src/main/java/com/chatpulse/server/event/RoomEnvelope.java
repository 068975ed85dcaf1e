package com.chatpulse.server.event;

/**
 * Body of the room-scoped broadcasts: {@code message}, {@code message_deleted} and {@code mod_action}.
 */
public class RoomEnvelope {
    public final String type;
    public final Object data;
    public final String timestamp;

    public RoomEnvelope(String type, Object data, String timestamp) {
        this.type = type;
        this.data = data;
        this.timestamp = timestamp;
    }
}
