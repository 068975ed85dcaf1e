package com.chatpulse.server.http;

import com.chatpulse.server.metrics.MpsUpdate;
import com.chatpulse.server.metrics.ThroughputAggregator;
import com.chatpulse.server.room.RoomGroups;
import com.chatpulse.server.room.RoomId;
import com.chatpulse.server.ws.RelayServer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only relay introspection for the admin/metrics collaborator.
 */
@RestController
@RequestMapping("/internal/relay")
public class RelayStatsController {

    private final RelayServer relay;
    private final RoomGroups groups;
    private final ThroughputAggregator aggregator;

    @Value("${internal.token}")
    private String token;

    public RelayStatsController(RelayServer relay, RoomGroups groups, ThroughputAggregator aggregator) {
        this.relay = relay;
        this.groups = groups;
        this.aggregator = aggregator;
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats(
            @RequestHeader(value = "Authorization", required = false) String auth) {
        if (!InternalAuth.authorized(auth, token)) {
            return ResponseEntity.status(401).build();
        }
        MpsUpdate last = aggregator.lastUpdate();
        Map<String, Object> lastTick = new LinkedHashMap<>();
        lastTick.put("mps", last.mps);
        lastTick.put("channelMps", last.channelMps);
        lastTick.put("timestamp", last.timestamp);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("connectedClients", relay.connectedClientCount());
        body.put("globalSubscribers", relay.globalSubscriberCount());
        body.put("rooms", groups.channelSizes());
        body.put("lastTick", lastTick);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/rooms/{channel}")
    public ResponseEntity<Map<String, Object>> room(
            @RequestHeader(value = "Authorization", required = false) String auth,
            @PathVariable("channel") String channel) {
        if (!InternalAuth.authorized(auth, token)) {
            return ResponseEntity.status(401).build();
        }
        RoomId room = RoomId.channel(channel);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", room.name());
        body.put("subscribers", relay.roomSubscriberCount(room.name()));
        return ResponseEntity.ok(body);
    }
}
