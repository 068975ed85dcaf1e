package com.chatpulse.server.ws;

import com.chatpulse.server.event.RelayFrames;
import com.chatpulse.server.event.RelayFrames.ClientFrame;
import com.chatpulse.server.exception.InvalidControlFrameException;
import com.chatpulse.server.exception.InvalidRoomNameException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Relay socket endpoint:
 * - connection established: register the connection with an empty membership
 * - text frame: subscribe / unsubscribe / subscribe_global / unsubscribe_global / ping
 * - connection closed or transport error: leave every room, then forget the connection
 */
@Component
public class RelayWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(RelayWebSocketHandler.class);

    private final RelayServer relay;
    private final RelayFrames frames;
    private final Executor outboundExecutor;
    private final Clock clock;
    private final int queueCapacity;

    public RelayWebSocketHandler(RelayServer relay,
                                 RelayFrames frames,
                                 @Qualifier("relayOutboundExecutor") Executor outboundExecutor,
                                 Clock clock,
                                 @Value("${relay.outbound.queue-capacity:1024}") int queueCapacity) {
        this.relay = relay;
        this.frames = frames;
        this.outboundExecutor = outboundExecutor;
        this.clock = clock;
        this.queueCapacity = queueCapacity;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        RelayConnection conn = new RelayConnection(session, remoteAddress(session), queueCapacity,
                outboundExecutor, clock, c -> relay.disconnect(c.connectionId()));
        relay.connect(conn);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        RelayConnection conn = relay.connection(session.getId());
        if (conn == null) return;
        conn.touch();

        String event = null;
        try {
            ClientFrame frame = frames.decode(message.getPayload());
            event = frame.event;
            dispatch(conn, frame);
        } catch (InvalidControlFrameException e) {
            log.warn("[WARN] bad frame conn={} event={} {}", conn.connectionId(), e.getEvent(), e.getMessage());
            replyError(conn, e.getEvent(), e.getMessage());
        } catch (InvalidRoomNameException e) {
            log.warn("[WARN] bad channel conn={} event={} {}", conn.connectionId(), event, e.getMessage());
            replyError(conn, event, e.getMessage());
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        RelayConnection conn = relay.connection(session.getId());
        if (conn != null) conn.touch();
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WARN] transport error conn={} {}", session.getId(), exception.getMessage());
        relay.disconnect(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        relay.disconnect(session.getId());
    }

    private void dispatch(RelayConnection conn, ClientFrame frame) {
        String id = conn.connectionId();
        switch (frame.event) {
            case "subscribe": {
                List<String> joined = relay.subscribe(id, channels(frame));
                conn.deliver(frames.encode("subscribed", Map.of("channels", joined)));
                break;
            }
            case "unsubscribe": {
                List<String> left = relay.unsubscribe(id, channels(frame));
                conn.deliver(frames.encode("unsubscribed", Map.of("channels", left)));
                break;
            }
            case "subscribe_global":
                relay.subscribeGlobal(id);
                conn.deliver(frames.encode("subscribed_global", Map.of()));
                break;
            case "unsubscribe_global":
                relay.unsubscribeGlobal(id);
                conn.deliver(frames.encode("unsubscribed_global", Map.of()));
                break;
            case "ping":
                conn.deliver(frames.encode("pong", Map.of("timestamp", frames.now())));
                break;
            default:
                throw new InvalidControlFrameException(frame.event, "unknown event");
        }
    }

    /** Accepts {@code {channels: "a"}} as well as {@code {channels: ["a", "b"]}}. */
    private static List<String> channels(ClientFrame frame) {
        JsonNode data = frame.data;
        JsonNode node = data == null ? null : data.get("channels");
        if (node == null || node.isNull()) {
            throw new InvalidControlFrameException(frame.event, "missing channels");
        }
        List<String> out = new ArrayList<>();
        if (node.isTextual()) {
            out.add(node.asText());
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                if (!item.isTextual()) {
                    throw new InvalidControlFrameException(frame.event, "channels must be strings");
                }
                out.add(item.asText());
            }
        } else {
            throw new InvalidControlFrameException(frame.event, "channels must be a string or an array");
        }
        if (out.isEmpty()) {
            throw new InvalidControlFrameException(frame.event, "no channels given");
        }
        return out;
    }

    private void replyError(RelayConnection conn, String event, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", event);
        body.put("message", message);
        conn.deliver(frames.encode("error", body));
    }

    private static String remoteAddress(WebSocketSession session) {
        Object fromHandshake = session.getAttributes().get(ConnectionLimitInterceptor.REMOTE_ADDRESS_ATTR);
        if (fromHandshake instanceof String) return (String) fromHandshake;
        InetSocketAddress addr = session.getRemoteAddress();
        if (addr == null) return "unknown";
        return addr.getAddress() != null ? addr.getAddress().getHostAddress() : addr.getHostString();
    }
}
