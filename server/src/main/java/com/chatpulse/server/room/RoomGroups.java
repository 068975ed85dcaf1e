package com.chatpulse.server.room;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Room to member-set mapping and the fan-out primitive.
 * Rooms are created on first join and dropped when the last member leaves.
 */
@Component
public class RoomGroups {
    private static final Logger log = LoggerFactory.getLogger(RoomGroups.class);

    private final Map<RoomId, Set<RoomMember>> rooms = new ConcurrentHashMap<>();

    /** @return true if the member was not already in the room */
    public boolean join(RoomId room, RoomMember member) {
        boolean[] added = new boolean[1];
        rooms.compute(room, (k, set) -> {
            if (set == null) set = ConcurrentHashMap.newKeySet();
            added[0] = set.add(member);
            return set;
        });
        return added[0];
    }

    /** @return true if the member was in the room */
    public boolean leave(RoomId room, RoomMember member) {
        boolean[] removed = new boolean[1];
        rooms.computeIfPresent(room, (k, set) -> {
            removed[0] = set.remove(member);
            return set.isEmpty() ? null : set;
        });
        return removed[0];
    }

    /**
     * Removes the member from the given rooms, normally the membership set the registry recorded for it.
     */
    public void leaveAll(RoomMember member, Collection<RoomId> joined) {
        for (RoomId room : joined) {
            leave(room, member);
        }
    }

    public int memberCount(RoomId room) {
        Set<RoomMember> set = rooms.get(room);
        return set == null ? 0 : set.size();
    }

    public boolean isMember(RoomId room, RoomMember member) {
        Set<RoomMember> set = rooms.get(room);
        return set != null && set.contains(member);
    }

    /**
     * Hands the frame to every current member. Members joining or leaving during the loop may or may not
     * see this frame; the iteration itself never fails on concurrent change.
     *
     * @return number of members that accepted the frame
     */
    public int deliver(RoomId room, String frame) {
        Set<RoomMember> set = rooms.get(room);
        if (set == null) return 0;
        int ok = 0;
        for (RoomMember member : set) {
            try {
                if (member.deliver(frame)) ok++;
            } catch (RuntimeException e) {
                log.warn("[WARN] deliver fail room={} conn={} {}", room, member.connectionId(), e.getMessage());
            }
        }
        return ok;
    }

    /** Channel rooms and their sizes, sorted by name. The global room is not included. */
    public Map<String, Integer> channelSizes() {
        Map<String, Integer> sizes = new TreeMap<>();
        rooms.forEach((room, set) -> {
            if (!room.isGlobal() && !set.isEmpty()) sizes.put(room.name(), set.size());
        });
        return sizes;
    }
}
