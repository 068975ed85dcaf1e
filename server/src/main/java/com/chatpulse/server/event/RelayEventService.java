package com.chatpulse.server.event;

import com.chatpulse.server.exception.InvalidRoomNameException;
import com.chatpulse.server.metrics.ThroughputAggregator;
import com.chatpulse.server.room.RoomGroups;
import com.chatpulse.server.room.RoomId;
import com.chatpulse.server.ws.RelayConnection;
import com.chatpulse.server.ws.RelayServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RelayEventService implements RelayEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(RelayEventService.class);

    private final RoomGroups groups;
    private final ThroughputAggregator aggregator;
    private final RelayServer relay;
    private final RelayFrames frames;

    public RelayEventService(RoomGroups groups,
                             ThroughputAggregator aggregator,
                             RelayServer relay,
                             RelayFrames frames) {
        this.groups = groups;
        this.aggregator = aggregator;
        this.relay = relay;
        this.frames = frames;
    }

    @Override
    public void publishMessage(String channel, Object payload) {
        try {
            RoomId room = resolve(channel, EventNames.MESSAGE);
            aggregator.record(room);
            if (room != null) deliverToRoom(room, EventNames.MESSAGE, "message", payload);
        } catch (RuntimeException e) {
            log.error("[ERROR] publish {} failed channel={}", EventNames.MESSAGE, channel, e);
        }
    }

    @Override
    public void publishMessageDeleted(String channel, Object payload) {
        try {
            RoomId room = resolve(channel, EventNames.MESSAGE_DELETED);
            if (room != null) deliverToRoom(room, EventNames.MESSAGE_DELETED, "delete", payload);
        } catch (RuntimeException e) {
            log.error("[ERROR] publish {} failed channel={}", EventNames.MESSAGE_DELETED, channel, e);
        }
    }

    @Override
    public void publishModAction(String channel, Object payload) {
        try {
            RoomId room = resolve(channel, EventNames.MOD_ACTION);
            if (room != null) deliverToRoom(room, EventNames.MOD_ACTION, "mod_action", payload);
        } catch (RuntimeException e) {
            log.error("[ERROR] publish {} failed channel={}", EventNames.MOD_ACTION, channel, e);
        }
    }

    @Override
    public void publishGlobal(String event, Object payload) {
        if (event == null || event.isBlank()) {
            log.warn("[WARN] global publish without event name dropped");
            return;
        }
        try {
            if (groups.memberCount(RoomId.GLOBAL) == 0) return;
            String frame = frames.encode(event, frames.withTimestamp(payload, frames.now()));
            int ok = groups.deliver(RoomId.GLOBAL, frame);
            log.debug("[BROADCAST] event={} room=global delivered={}", event, ok);
        } catch (RuntimeException e) {
            log.error("[ERROR] publish {} to global failed", event, e);
        }
    }

    @Override
    public void publishToAll(String event, Object payload) {
        if (event == null || event.isBlank()) {
            log.warn("[WARN] broadcast without event name dropped");
            return;
        }
        try {
            String frame = frames.encode(event, frames.withTimestamp(payload, frames.now()));
            int ok = 0;
            for (RelayConnection conn : relay.connections()) {
                if (conn.deliver(frame)) ok++;
            }
            log.debug("[BROADCAST] event={} scope=all delivered={}", event, ok);
        } catch (RuntimeException e) {
            log.error("[ERROR] broadcast {} failed", event, e);
        }
    }

    private void deliverToRoom(RoomId room, String event, String type, Object payload) {
        if (groups.memberCount(room) == 0) return;
        String frame = frames.encode(event, new RoomEnvelope(type, payload, frames.now()));
        int ok = groups.deliver(room, frame);
        log.debug("[BROADCAST] event={} room={} delivered={}", event, room.name(), ok);
    }

    // null means "no room": counted globally, delivered nowhere
    private static RoomId resolve(String channel, String event) {
        if (channel == null || channel.isBlank()) return null;
        try {
            return RoomId.channel(channel);
        } catch (InvalidRoomNameException e) {
            log.warn("[WARN] {} dropped: {}", event, e.getMessage());
            return null;
        }
    }
}
