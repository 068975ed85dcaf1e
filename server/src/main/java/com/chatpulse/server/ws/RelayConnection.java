package com.chatpulse.server.ws;

import com.chatpulse.server.room.RoomMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One live client session and its outbound path.
 * <p>
 * Producers only enqueue into a bounded FIFO; a shared executor drains it to the socket with at most one drain
 * task per connection, which keeps per-connection order. A full queue means the client is too slow: it is
 * terminated (close status {@code SESSION_NOT_RELIABLE}) instead of buffering without limit.
 */
public class RelayConnection implements RoomMember {
    private static final Logger log = LoggerFactory.getLogger(RelayConnection.class);

    private final WebSocketSession session;
    private final String remoteAddress;
    private final BlockingQueue<WebSocketMessage<?>> outbound;
    private final Executor executor;
    private final Clock clock;
    private final Consumer<RelayConnection> onTerminate;

    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile long lastSeenMillis;

    public RelayConnection(WebSocketSession session,
                           String remoteAddress,
                           int queueCapacity,
                           Executor executor,
                           Clock clock,
                           Consumer<RelayConnection> onTerminate) {
        this.session = session;
        this.remoteAddress = remoteAddress;
        this.outbound = new ArrayBlockingQueue<>(queueCapacity);
        this.executor = executor;
        this.clock = clock;
        this.onTerminate = onTerminate;
        this.lastSeenMillis = clock.millis();
    }

    @Override
    public String connectionId() {
        return session.getId();
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    @Override
    public boolean deliver(String frame) {
        return enqueue(new TextMessage(frame));
    }

    public boolean sendPing() {
        return enqueue(new PingMessage());
    }

    public void touch() {
        lastSeenMillis = clock.millis();
    }

    public long lastSeenMillis() {
        return lastSeenMillis;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int pendingFrames() {
        return outbound.size();
    }

    /**
     * Relay-side close: removes the connection from the relay first, then closes the socket.
     */
    public void terminate(CloseStatus status, String reason) {
        if (!markClosed()) return;
        log.warn("[TERMINATE] conn={} addr={} reason={}", connectionId(), remoteAddress, reason);
        onTerminate.accept(this);
        try {
            executor.execute(() -> closeSession(status));
        } catch (RejectedExecutionException e) {
            closeSession(status);
        }
    }

    /**
     * Stops all further delivery.
     *
     * @return false if the connection was already closed
     */
    boolean markClosed() {
        if (!closed.compareAndSet(false, true)) return false;
        outbound.clear();
        return true;
    }

    private boolean enqueue(WebSocketMessage<?> message) {
        if (closed.get()) return false;
        if (!outbound.offer(message)) {
            terminate(CloseStatus.SESSION_NOT_RELIABLE, "outbound queue full (" + outbound.size() + ")");
            return false;
        }
        scheduleDrain();
        return true;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) return;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            terminate(CloseStatus.GOING_AWAY, "outbound executor unavailable");
        }
    }

    private void drain() {
        try {
            WebSocketMessage<?> next;
            while (!closed.get() && (next = outbound.poll()) != null) {
                session.sendMessage(next);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("[WARN] send fail conn={} {}", connectionId(), e.getMessage());
            draining.set(false);
            terminate(CloseStatus.SERVER_ERROR, "send failed");
            return;
        }
        draining.set(false);
        // a producer may have enqueued after the last poll but before the flag was cleared
        if (!closed.get() && !outbound.isEmpty()) scheduleDrain();
    }

    private void closeSession(CloseStatus status) {
        if (!session.isOpen()) return;
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("close failed conn={} {}", connectionId(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "RelayConnection{" + connectionId() + "}";
    }
}
