package com.chatpulse.server.metrics;

import com.chatpulse.server.room.RoomId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts taken out of one counting window.
 */
public class ThroughputSnapshot {

    private final long total;
    private final Map<RoomId, Long> perRoom;

    public ThroughputSnapshot(long total, Map<RoomId, Long> perRoom) {
        this.total = total;
        this.perRoom = Collections.unmodifiableMap(new LinkedHashMap<>(perRoom));
    }

    public long total() {
        return total;
    }

    /** Rooms with at least one message in the window. */
    public Map<RoomId, Long> perRoom() {
        return perRoom;
    }

    public long countFor(RoomId room) {
        return perRoom.getOrDefault(room, 0L);
    }
}
