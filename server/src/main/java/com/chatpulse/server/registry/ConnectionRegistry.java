package com.chatpulse.server.registry;

import com.chatpulse.server.room.RoomId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Which rooms each live connection is subscribed to.
 * <p>
 * Does not touch {@link com.chatpulse.server.room.RoomGroups}; callers update both together.
 * Operations on an unknown connection id are a caller bug: they throw in strict mode and are logged and
 * ignored otherwise.
 */
@Component
public class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, Set<RoomId>> memberships = new ConcurrentHashMap<>();
    private final boolean strict;

    public ConnectionRegistry(@Value("${relay.registry.strict:false}") boolean strict) {
        this.strict = strict;
    }

    public void register(String connectionId) {
        memberships.put(connectionId, ConcurrentHashMap.newKeySet());
    }

    /**
     * Drops the entry.
     *
     * @return the rooms the connection was in, empty if it was unknown
     */
    public Set<RoomId> forget(String connectionId) {
        Set<RoomId> rooms = memberships.remove(connectionId);
        if (rooms == null) {
            unknown("forget", connectionId);
            return Set.of();
        }
        return rooms;
    }

    /** @return true if the room was newly recorded */
    public boolean recordJoin(String connectionId, RoomId room) {
        Set<RoomId> rooms = memberships.get(connectionId);
        if (rooms == null) {
            unknown("join", connectionId);
            return false;
        }
        return rooms.add(room);
    }

    /** @return true if the room was recorded before */
    public boolean recordLeave(String connectionId, RoomId room) {
        Set<RoomId> rooms = memberships.get(connectionId);
        if (rooms == null) {
            unknown("leave", connectionId);
            return false;
        }
        return rooms.remove(room);
    }

    public Set<RoomId> roomsOf(String connectionId) {
        Set<RoomId> rooms = memberships.get(connectionId);
        return rooms == null ? Set.of() : Set.copyOf(rooms);
    }

    public boolean isRegistered(String connectionId) {
        return memberships.containsKey(connectionId);
    }

    public int size() {
        return memberships.size();
    }

    private void unknown(String op, String connectionId) {
        if (strict) {
            throw new IllegalStateException("registry " + op + " on unknown connection " + connectionId);
        }
        log.warn("[REGISTRY] {} on unknown connection {} ignored", op, connectionId);
    }
}
