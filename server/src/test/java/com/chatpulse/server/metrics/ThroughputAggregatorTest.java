package com.chatpulse.server.metrics;

import com.chatpulse.server.event.RelayFrames;
import com.chatpulse.server.room.RecordingMember;
import com.chatpulse.server.room.RoomGroups;
import com.chatpulse.server.room.RoomId;
import com.chatpulse.server.room.RoomMember;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ThroughputAggregatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RoomGroups groups = new RoomGroups();
    private final RelayFrames frames = new RelayFrames(MAPPER,
            Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    private final ThroughputAggregator aggregator = new ThroughputAggregator(groups, frames, 1000, false);

    private final RoomId foo = RoomId.channel("foo");
    private final RoomId bar = RoomId.channel("bar");

    @AfterEach
    void tearDown() {
        aggregator.stop();
    }

    @Test
    void tickReportsGlobalAndPerChannelRates() throws Exception {
        RecordingMember dashboard = new RecordingMember("dash");
        RecordingMember fooViewer = new RecordingMember("foo-viewer");
        RecordingMember barViewer = new RecordingMember("bar-viewer");
        groups.join(RoomId.GLOBAL, dashboard);
        groups.join(foo, fooViewer);
        groups.join(bar, barViewer);

        for (int i = 0; i < 5; i++) aggregator.record(foo);
        for (int i = 0; i < 3; i++) aggregator.record(bar);

        aggregator.tick();

        assertThat(dashboard.frames).hasSize(1);
        JsonNode update = MAPPER.readTree(dashboard.frames.get(0));
        assertThat(update.get("event").asText()).isEqualTo("mps_update");
        assertThat(update.at("/data/mps").asLong()).isEqualTo(8);
        assertThat(update.at("/data/channelMps/foo").asLong()).isEqualTo(5);
        assertThat(update.at("/data/channelMps/bar").asLong()).isEqualTo(3);
        assertThat(update.at("/data/timestamp").asText()).isEqualTo("2026-03-01T12:00:00Z");

        JsonNode fooRate = MAPPER.readTree(fooViewer.frames.get(0));
        assertThat(fooRate.get("event").asText()).isEqualTo("channel_mps");
        assertThat(fooRate.at("/data/channel").asText()).isEqualTo("foo");
        assertThat(fooRate.at("/data/mps").asLong()).isEqualTo(5);
        assertThat(fooViewer.frames).hasSize(1);
        assertThat(MAPPER.readTree(barViewer.frames.get(0)).at("/data/mps").asLong()).isEqualTo(3);
    }

    @Test
    void countersStartFromZeroAfterATick() {
        aggregator.record(foo);
        aggregator.record(foo);

        assertThat(aggregator.snapshot().countFor(foo)).isEqualTo(2);

        ThroughputSnapshot next = aggregator.snapshot();
        assertThat(next.total()).isZero();
        assertThat(next.perRoom()).isEmpty();
    }

    @Test
    void idleChannelsGetNoChannelRateFrame() {
        RecordingMember fooViewer = new RecordingMember("foo-viewer");
        RecordingMember barViewer = new RecordingMember("bar-viewer");
        groups.join(foo, fooViewer);
        groups.join(bar, barViewer);
        aggregator.record(foo);

        aggregator.tick();

        assertThat(fooViewer.frames).hasSize(1);
        assertThat(barViewer.frames).isEmpty();
        assertThat(aggregator.lastUpdate().channelMps).containsOnlyKeys("foo");
    }

    @Test
    void roomlessMessagesCountOnlyGlobally() {
        aggregator.record(null);
        aggregator.record(foo);

        ThroughputSnapshot snap = aggregator.snapshot();

        assertThat(snap.total()).isEqualTo(2);
        assertThat(snap.perRoom()).containsOnlyKeys(foo);
    }

    @Test
    void noIncrementIsLostUnderConcurrentSnapshots() throws Exception {
        int producers = 8;
        int perProducer = 25_000;
        ExecutorService pool = Executors.newFixedThreadPool(producers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean producing = new AtomicBoolean(true);
        AtomicLong seenTotal = new AtomicLong();
        AtomicLong seenFoo = new AtomicLong();

        Future<?> snapshotter = pool.submit(() -> {
            start.await();
            while (producing.get()) {
                ThroughputSnapshot s = aggregator.snapshot();
                seenTotal.addAndGet(s.total());
                seenFoo.addAndGet(s.countFor(foo));
            }
            return null;
        });
        List<Future<?>> workers = new ArrayList<>();
        for (int p = 0; p < producers; p++) {
            int id = p;
            workers.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perProducer; i++) {
                    aggregator.record(id % 2 == 0 ? foo : bar);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> w : workers) w.get(60, TimeUnit.SECONDS);
        producing.set(false);
        snapshotter.get(10, TimeUnit.SECONDS);
        pool.shutdown();

        ThroughputSnapshot rest = aggregator.snapshot();
        seenTotal.addAndGet(rest.total());
        seenFoo.addAndGet(rest.countFor(foo));

        assertThat(seenTotal.get()).isEqualTo((long) producers * perProducer);
        assertThat(seenFoo.get()).isEqualTo((long) producers / 2 * perProducer);
    }

    @Test
    void oneFailingRoomDoesNotBlockTheOthers() {
        RoomMember broken = new RoomMember() {
            @Override
            public String connectionId() {
                return "broken";
            }

            @Override
            public boolean deliver(String frame) {
                throw new IllegalStateException("boom");
            }
        };
        RecordingMember barViewer = new RecordingMember("bar-viewer");
        RecordingMember dashboard = new RecordingMember("dash");
        groups.join(foo, broken);
        groups.join(bar, barViewer);
        groups.join(RoomId.GLOBAL, dashboard);
        aggregator.record(foo);
        aggregator.record(bar);

        aggregator.tick();

        assertThat(barViewer.frames).hasSize(1);
        assertThat(dashboard.frames).hasSize(1);
    }

    @Test
    void startedTimerKeepsTicking() {
        ThroughputAggregator fast = new ThroughputAggregator(groups, frames, 20, false);
        RecordingMember dashboard = new RecordingMember("dash");
        groups.join(RoomId.GLOBAL, dashboard);
        try {
            fast.start();
            assertThat(fast.isRunning()).isTrue();
            await().atMost(5, TimeUnit.SECONDS).until(() -> dashboard.frames.size() >= 3);
        } finally {
            fast.stop();
        }
        assertThat(fast.isRunning()).isFalse();
    }

    @Test
    void ratesAreScaledToPerSecond() {
        ThroughputAggregator halfSecond = new ThroughputAggregator(groups, frames, 500, false);
        for (int i = 0; i < 4; i++) halfSecond.record(foo);

        halfSecond.tick();

        assertThat(halfSecond.lastUpdate().mps).isEqualTo(8);
        assertThat(halfSecond.lastUpdate().channelMps).containsEntry("foo", 8L);
    }
}
