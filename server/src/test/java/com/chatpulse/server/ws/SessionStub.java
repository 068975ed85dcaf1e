package com.chatpulse.server.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mockito-backed {@link WebSocketSession} that records what the relay sends.
 */
public class SessionStub {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public final WebSocketSession session;
    public final List<WebSocketMessage<?>> sent = new CopyOnWriteArrayList<>();
    public final AtomicBoolean open = new AtomicBoolean(true);
    public volatile CloseStatus closedWith;

    private SessionStub(String id) throws IOException {
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.getAttributes()).thenReturn(new HashMap<>());
        when(session.isOpen()).thenAnswer(inv -> open.get());
        doAnswer(inv -> {
            sent.add(inv.getArgument(0));
            return null;
        }).when(session).sendMessage(any());
        doAnswer(inv -> {
            closedWith = inv.getArgument(0);
            open.set(false);
            return null;
        }).when(session).close(any(CloseStatus.class));
    }

    public static SessionStub open(String id) {
        try {
            return new SessionStub(id);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    /** Payloads of the text frames sent so far. */
    public List<String> texts() {
        return sent.stream()
                .filter(m -> m instanceof TextMessage)
                .map(m -> ((TextMessage) m).getPayload())
                .collect(Collectors.toList());
    }

    /** Parsed frames with the given event name. */
    public List<JsonNode> framesFor(String event) {
        return texts().stream()
                .map(SessionStub::parse)
                .filter(n -> event.equals(n.path("event").asText()))
                .collect(Collectors.toList());
    }

    private static JsonNode parse(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (IOException e) {
            throw new IllegalStateException("not json: " + text, e);
        }
    }
}
