package com.chatpulse.server.http;

import com.chatpulse.server.event.RelayEventPublisher;
import com.chatpulse.server.exception.RelayException;
import com.chatpulse.server.room.RoomId;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Internal ingest endpoints for producers running out of process (chat ingest, moderation, status poller).
 */
@RestController
@RequestMapping("/internal/events")
public class InternalEventController {
    private static final Logger log = LoggerFactory.getLogger(InternalEventController.class);

    private final RelayEventPublisher publisher;

    @Value("${internal.token}")
    private String token;

    public InternalEventController(RelayEventPublisher publisher) {
        this.publisher = publisher;
    }

    @PostMapping("/{kind}")
    public ResponseEntity<Void> publish(
            @RequestHeader(value = "Authorization", required = false) String auth,
            @PathVariable("kind") String kind,
            @Valid @RequestBody IngestRequest req) {

        if (!InternalAuth.authorized(auth, token)) {
            return ResponseEntity.status(401).build();
        }

        switch (kind) {
            case "message":
                publisher.publishMessage(requireChannel(req), req.data);
                break;
            case "message-deleted":
                publisher.publishMessageDeleted(requireChannel(req), req.data);
                break;
            case "mod-action":
                publisher.publishModAction(requireChannel(req), req.data);
                break;
            case "global":
                publisher.publishGlobal(requireEvent(req), req.data);
                break;
            case "all":
                publisher.publishToAll(requireEvent(req), req.data);
                break;
            default:
                return ResponseEntity.notFound().build();
        }
        log.debug("[INGEST] kind={} channel={} event={}", kind, req.channel, req.event);
        return ResponseEntity.noContent().build(); // 204
    }

    private static String requireChannel(IngestRequest req) {
        if (req.channel == null || req.channel.isBlank()) throw new RelayException("channel is required");
        return RoomId.channel(req.channel).name();
    }

    private static String requireEvent(IngestRequest req) {
        if (req.event == null || req.event.isBlank()) throw new RelayException("event is required");
        return req.event;
    }
}
