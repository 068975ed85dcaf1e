package com.chatpulse.server.ws;

import com.chatpulse.server.registry.ConnectionRegistry;
import com.chatpulse.server.room.RoomGroups;
import com.chatpulse.server.room.RoomId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the connection table and keeps {@link ConnectionRegistry} and {@link RoomGroups} in lockstep.
 * <p>
 * Membership changes and disconnect for one connection run under that connection's monitor, so a subscribe
 * racing a disconnect cannot leave a stale membership behind. The monitor is never held during fan-out.
 */
@Component
public class RelayServer {
    private static final Logger log = LoggerFactory.getLogger(RelayServer.class);

    private final ConnectionRegistry registry;
    private final RoomGroups groups;

    private final Map<String, RelayConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> perAddress = new ConcurrentHashMap<>();

    public RelayServer(ConnectionRegistry registry, RoomGroups groups) {
        this.registry = registry;
        this.groups = groups;
    }

    public void connect(RelayConnection conn) {
        String id = conn.connectionId();
        registry.register(id);
        connections.put(id, conn);
        // increment inside compute so a concurrent disconnect cannot drop the entry in between
        perAddress.compute(conn.remoteAddress(), (k, n) -> {
            if (n == null) n = new AtomicInteger();
            n.incrementAndGet();
            return n;
        });
        log.info("[CONNECT] conn={} addr={} total={}", id, conn.remoteAddress(), connections.size());
    }

    /**
     * Removes the connection from every room it joined and forgets it. Safe to call more than once.
     *
     * @return true if the connection was live
     */
    public boolean disconnect(String connectionId) {
        RelayConnection conn = connections.remove(connectionId);
        if (conn == null) return false;
        Set<RoomId> rooms;
        synchronized (conn) {
            conn.markClosed();
            rooms = registry.forget(connectionId);
            groups.leaveAll(conn, rooms);
        }
        perAddress.computeIfPresent(conn.remoteAddress(), (k, n) -> n.decrementAndGet() <= 0 ? null : n);
        log.info("[DISCONNECT] conn={} rooms={} total={}", connectionId, rooms.size(), connections.size());
        return true;
    }

    /**
     * Joins the given channels. All names are validated before any room is joined.
     *
     * @return normalized channel names, in request order without duplicates
     * @throws com.chatpulse.server.exception.InvalidRoomNameException on the first invalid name
     */
    public List<String> subscribe(String connectionId, List<String> channels) {
        List<RoomId> rooms = resolve(channels);
        RelayConnection conn = connections.get(connectionId);
        if (conn == null) return List.of();
        synchronized (conn) {
            if (conn.isClosed()) return List.of();
            for (RoomId room : rooms) {
                groups.join(room, conn);
                registry.recordJoin(connectionId, room);
                log.debug("[JOIN] conn={} room={} total={}", connectionId, room, groups.memberCount(room));
            }
        }
        return names(rooms);
    }

    public List<String> unsubscribe(String connectionId, List<String> channels) {
        List<RoomId> rooms = resolve(channels);
        RelayConnection conn = connections.get(connectionId);
        if (conn == null) return List.of();
        synchronized (conn) {
            if (conn.isClosed()) return List.of();
            for (RoomId room : rooms) {
                groups.leave(room, conn);
                registry.recordLeave(connectionId, room);
                log.debug("[LEAVE] conn={} room={} remaining={}", connectionId, room, groups.memberCount(room));
            }
        }
        return names(rooms);
    }

    public boolean subscribeGlobal(String connectionId) {
        RelayConnection conn = connections.get(connectionId);
        if (conn == null) return false;
        synchronized (conn) {
            if (conn.isClosed()) return false;
            groups.join(RoomId.GLOBAL, conn);
            registry.recordJoin(connectionId, RoomId.GLOBAL);
        }
        return true;
    }

    public boolean unsubscribeGlobal(String connectionId) {
        RelayConnection conn = connections.get(connectionId);
        if (conn == null) return false;
        synchronized (conn) {
            if (conn.isClosed()) return false;
            groups.leave(RoomId.GLOBAL, conn);
            registry.recordLeave(connectionId, RoomId.GLOBAL);
        }
        return true;
    }

    public int connectedClientCount() {
        return connections.size();
    }

    /** @throws com.chatpulse.server.exception.InvalidRoomNameException if the name is not a valid channel */
    public int roomSubscriberCount(String channel) {
        return groups.memberCount(RoomId.channel(channel));
    }

    public int globalSubscriberCount() {
        return groups.memberCount(RoomId.GLOBAL);
    }

    public int connectionCountFrom(String remoteAddress) {
        AtomicInteger n = perAddress.get(remoteAddress);
        return n == null ? 0 : n.get();
    }

    public RelayConnection connection(String connectionId) {
        return connections.get(connectionId);
    }

    public Collection<RelayConnection> connections() {
        return Collections.unmodifiableCollection(connections.values());
    }

    private static List<RoomId> resolve(List<String> channels) {
        Set<RoomId> rooms = new LinkedHashSet<>();
        for (String channel : channels) {
            rooms.add(RoomId.channel(channel));
        }
        return new ArrayList<>(rooms);
    }

    private static List<String> names(List<RoomId> rooms) {
        List<String> out = new ArrayList<>(rooms.size());
        for (RoomId room : rooms) out.add(room.name());
        return out;
    }
}
