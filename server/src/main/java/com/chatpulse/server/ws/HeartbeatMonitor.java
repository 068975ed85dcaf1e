package com.chatpulse.server.ws;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Pings every connection on a fixed interval and closes the ones that stayed silent past the timeout.
 * Any inbound frame or pong counts as a sign of life.
 */
@Component
public class HeartbeatMonitor {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final RelayServer relay;
    private final Clock clock;
    private final long intervalMillis;
    private final long timeoutMillis;

    private ScheduledExecutorService scheduler;

    public HeartbeatMonitor(RelayServer relay,
                            Clock clock,
                            @Value("${relay.heartbeat-millis:30000}") long intervalMillis,
                            @Value("${relay.connection-timeout-millis:60000}") long timeoutMillis) {
        this.relay = relay;
        this.clock = clock;
        this.intervalMillis = intervalMillis;
        this.timeoutMillis = timeoutMillis;
    }

    @PostConstruct
    public void start() {
        if (intervalMillis <= 0) {
            log.info("[BOOT] heartbeat disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-heartbeat");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> {
            try {
                sweep();
            } catch (RuntimeException e) {
                log.error("[HEARTBEAT] sweep failed", e);
            }
        }, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("[BOOT] heartbeat every {}ms, timeout {}ms", intervalMillis, timeoutMillis);
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) scheduler.shutdownNow();
    }

    public int sweep() {
        return sweep(clock.millis());
    }

    /**
     * Closes connections idle since before {@code nowMillis - timeout} and pings the rest.
     *
     * @return number of connections closed
     */
    public int sweep(long nowMillis) {
        int reaped = 0;
        for (RelayConnection conn : List.copyOf(relay.connections())) {
            if (timeoutMillis > 0 && nowMillis - conn.lastSeenMillis() > timeoutMillis) {
                conn.terminate(CloseStatus.SESSION_NOT_RELIABLE, "idle for " + (nowMillis - conn.lastSeenMillis()) + "ms");
                reaped++;
            } else {
                conn.sendPing();
            }
        }
        if (reaped > 0) log.info("[HEARTBEAT] closed {} idle connections", reaped);
        return reaped;
    }
}
