package com.chatpulse.server.metrics;

import com.chatpulse.server.event.EventNames;
import com.chatpulse.server.event.RelayFrames;
import com.chatpulse.server.room.RoomGroups;
import com.chatpulse.server.room.RoomId;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Turns per-message increments into a messages-per-second signal.
 * <p>
 * Increments go into the current counting window under the shared side of a read/write lock. Each tick
 * swaps in a fresh window under the exclusive side, so the old window is quiescent by the time it is read:
 * no increment is lost or counted twice, and broadcasting never holds up counting.
 */
@Component
public class ThroughputAggregator {
    private static final Logger log = LoggerFactory.getLogger(ThroughputAggregator.class);

    private final RoomGroups groups;
    private final RelayFrames frames;
    private final long tickMillis;
    private final boolean autoStart;

    private final ReentrantReadWriteLock windowLock = new ReentrantReadWriteLock();
    // guarded by windowLock
    private Window current = new Window();

    private volatile MpsUpdate lastUpdate;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public ThroughputAggregator(RoomGroups groups,
                                RelayFrames frames,
                                @Value("${relay.mps.tick-millis:1000}") long tickMillis,
                                @Value("${relay.mps.enabled:true}") boolean autoStart) {
        if (tickMillis <= 0) throw new IllegalArgumentException("relay.mps.tick-millis must be positive");
        this.groups = groups;
        this.frames = frames;
        this.tickMillis = tickMillis;
        this.autoStart = autoStart;
        this.lastUpdate = new MpsUpdate(0, Map.of(), frames.now());
    }

    /** Counts one message; {@code room} may be null for messages without a channel. */
    public void record(RoomId room) {
        windowLock.readLock().lock();
        try {
            current.add(room);
        } finally {
            windowLock.readLock().unlock();
        }
    }

    /** Takes the counts accumulated since the previous snapshot and starts a new window. */
    public ThroughputSnapshot snapshot() {
        Window taken;
        windowLock.writeLock().lock();
        try {
            taken = current;
            current = new Window();
        } finally {
            windowLock.writeLock().unlock();
        }
        return taken.freeze();
    }

    /**
     * One aggregation step: snapshot, then one {@code mps_update} to the global room and one
     * {@code channel_mps} per active channel. A failing room is logged and skipped.
     */
    public void tick() {
        ThroughputSnapshot snap = snapshot();
        String ts = frames.now();

        Map<String, Long> channelMps = new TreeMap<>();
        snap.perRoom().forEach((room, count) -> channelMps.put(room.name(), perSecond(count)));

        MpsUpdate update = new MpsUpdate(perSecond(snap.total()), channelMps, ts);
        lastUpdate = update;
        try {
            if (groups.memberCount(RoomId.GLOBAL) > 0) {
                groups.deliver(RoomId.GLOBAL, frames.encode(EventNames.MPS_UPDATE, update));
            }
        } catch (RuntimeException e) {
            log.warn("[MPS] global update failed: {}", e.getMessage(), e);
        }

        for (Map.Entry<RoomId, Long> e : snap.perRoom().entrySet()) {
            RoomId room = e.getKey();
            try {
                if (groups.memberCount(room) == 0) continue;
                String frame = frames.encode(EventNames.CHANNEL_MPS,
                        new ChannelMps(room.name(), perSecond(e.getValue()), ts));
                groups.deliver(room, frame);
            } catch (RuntimeException ex) {
                log.warn("[MPS] channel update failed room={}: {}", room, ex.getMessage(), ex);
            }
        }
        if (log.isDebugEnabled() && snap.total() > 0) {
            log.debug("[MPS] total={} rooms={}", update.mps, channelMps.size());
        }
    }

    public MpsUpdate lastUpdate() {
        return lastUpdate;
    }

    @PostConstruct
    public void init() {
        if (autoStart) start();
    }

    public synchronized void start() {
        if (task != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-mps");
            t.setDaemon(true);
            return t;
        });
        task = scheduler.scheduleAtFixedRate(this::safeTick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        log.info("[BOOT] mps aggregator started tick={}ms", tickMillis);
    }

    @PreDestroy
    public synchronized void stop() {
        if (task == null) return;
        task.cancel(false);
        scheduler.shutdownNow();
        task = null;
        scheduler = null;
        log.info("[STOP] mps aggregator stopped");
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    // an exception escaping a scheduled task suppresses all later runs
    private void safeTick() {
        try {
            tick();
        } catch (Throwable t) {
            log.error("[MPS] tick failed", t);
        }
    }

    private long perSecond(long count) {
        return tickMillis == 1000 ? count : Math.round(count * 1000.0 / tickMillis);
    }

    private static final class Window {
        private final LongAdder total = new LongAdder();
        private final Map<RoomId, LongAdder> perRoom = new ConcurrentHashMap<>();

        void add(RoomId room) {
            total.increment();
            if (room != null) {
                perRoom.computeIfAbsent(room, k -> new LongAdder()).increment();
            }
        }

        ThroughputSnapshot freeze() {
            Map<RoomId, Long> counts = new HashMap<>();
            perRoom.forEach((room, adder) -> counts.put(room, adder.sum()));
            return new ThroughputSnapshot(total.sum(), counts);
        }
    }
}
