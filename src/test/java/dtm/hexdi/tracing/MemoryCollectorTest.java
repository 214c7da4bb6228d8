package dtm.hexdi.tracing;

import dtm.hexdi.common.ManualTimeSource;
import dtm.hexdi.prototypes.Lifetime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MemoryCollectorTest {

    private ManualTimeSource time;
    private int sequence;

    @BeforeEach
    void setUp() {
        time = new ManualTimeSource(50_000);
        sequence = 0;
    }

    private TraceEntry entry(String portName, double duration) {
        sequence++;
        return TraceEntry.builder()
                .id("trace-" + sequence)
                .portName(portName)
                .lifetime(Lifetime.SINGLETON)
                .startTime(time.currentTimeMillis())
                .duration(duration)
                .order(sequence)
                .build();
    }

    private static List<String> ids(List<TraceEntry> traces) {
        return traces.stream().map(TraceEntry::getId).toList();
    }

    private MemoryCollector collector(TraceRetentionPolicy policy) {
        return new MemoryCollector(policy, time);
    }

    @Test
    void evictsOldestUnpinnedPastCapacity() {
        MemoryCollector collector = collector(TraceRetentionPolicy.builder().maxTraces(3).build());

        for (int i = 0; i < 5; i++) {
            collector.collect(entry("Port" + i, 1));
        }

        assertEquals(List.of("trace-3", "trace-4", "trace-5"), ids(collector.getTraces()));
    }

    @Test
    void slowTracesArePinnedAndSurviveEviction() {
        MemoryCollector collector = collector(TraceRetentionPolicy.builder()
                .maxTraces(2)
                .slowThresholdMs(100)
                .build());

        collector.collect(entry("Slow", 150));
        collector.collect(entry("Fast", 1));
        collector.collect(entry("Fast", 1));
        collector.collect(entry("Fast", 1));

        List<TraceEntry> traces = collector.getTraces();
        assertEquals(List.of("trace-1", "trace-4"), ids(traces));
        assertTrue(traces.get(0).isPinned());
        assertFalse(traces.get(1).isPinned());
    }

    @Test
    void pinnedCapDropsOldestPinned() {
        MemoryCollector collector = collector(TraceRetentionPolicy.builder()
                .maxPinnedTraces(2)
                .slowThresholdMs(10)
                .build());

        collector.collect(entry("A", 20));
        collector.collect(entry("B", 1));
        collector.collect(entry("C", 20));
        collector.collect(entry("D", 20));

        assertEquals(List.of("trace-2", "trace-3", "trace-4"), ids(collector.getTraces()));
    }

    @Test
    void unpinnedTracesExpire() {
        MemoryCollector collector = collector(TraceRetentionPolicy.builder()
                .expiryMs(1_000)
                .slowThresholdMs(100)
                .build());

        collector.collect(entry("Old", 1));
        collector.collect(entry("OldButSlow", 500));
        time.advance(1_500);
        collector.collect(entry("Fresh", 1));

        assertEquals(List.of("trace-2", "trace-3"), ids(collector.getTraces()));
        assertEquals(2, collector.getStats().totalResolutions());
    }

    @Test
    void statsAreComputedFromTheBuffer() {
        MemoryCollector collector = collector(TraceRetentionPolicy.builder().maxTraces(3).slowThresholdMs(100).build());

        collector.collect(entry("A", 10));
        collector.collect(entry("B", 30).toBuilder().cacheHit(true).build());
        collector.collect(entry("C", 100));
        collector.collect(entry("D", 20));

        TraceStats stats = collector.getStats();

        assertEquals(3, stats.totalResolutions());
        assertEquals(150.0, stats.totalDuration(), 0.0001);
        assertEquals(50.0, stats.averageDuration(), 0.0001);
        assertEquals(1.0 / 3, stats.cacheHitRate(), 0.0001);
        assertEquals(1, stats.slowCount());
        assertEquals(50_000, stats.sessionStart());
    }

    @Test
    void emptyStatsKeepSessionStart() {
        MemoryCollector collector = collector(TraceRetentionPolicy.DEFAULT);

        TraceStats stats = collector.getStats();

        assertEquals(0, stats.totalResolutions());
        assertEquals(0.0, stats.averageDuration());
        assertEquals(50_000, stats.sessionStart());
    }

    @Test
    void filtersByEveryCriterion() {
        MemoryCollector collector = collector(TraceRetentionPolicy.DEFAULT);
        collector.collect(entry("UserService", 5).toBuilder().scopeId("scope-0").lifetime(Lifetime.SCOPED).build());
        collector.collect(entry("Logger", 1).toBuilder().cacheHit(true).build());
        collector.collect(entry("userRepository", 10).toBuilder().scopeId("scope-1").build());

        assertEquals(List.of("trace-1", "trace-3"),
                ids(collector.getTraces(TraceFilter.builder().portName("USER").build())));
        assertEquals(List.of("trace-1"),
                ids(collector.getTraces(TraceFilter.builder().lifetime(Lifetime.SCOPED).build())));
        assertEquals(List.of("trace-2"),
                ids(collector.getTraces(TraceFilter.builder().cacheHit(true).build())));
        assertEquals(List.of("trace-1", "trace-3"),
                ids(collector.getTraces(TraceFilter.builder().minDuration(5.0).maxDuration(10.0).build())));
        assertEquals(List.of("trace-2"),
                ids(collector.getTraces(TraceFilter.builder().rootScope().build())));
        assertEquals(List.of("trace-3"),
                ids(collector.getTraces(TraceFilter.builder().scopeId("scope-1").build())));
        assertEquals(3, collector.getTraces(TraceFilter.NONE).size());
        assertEquals(3, collector.getTraces(null).size());
    }

    @Test
    void manualPinningIsReversible() {
        MemoryCollector collector = collector(TraceRetentionPolicy.DEFAULT);
        collector.collect(entry("A", 1));
        collector.collect(entry("B", 1));

        collector.pin("trace-2");
        assertEquals(List.of("trace-2"), ids(collector.getTraces(TraceFilter.builder().pinned(true).build())));

        collector.unpin("trace-2");
        collector.pin("missing");
        assertTrue(collector.getTraces(TraceFilter.builder().pinned(true).build()).isEmpty());
    }

    @Test
    void failingSubscriberDoesNotStopOthers() {
        MemoryCollector collector = collector(TraceRetentionPolicy.DEFAULT);
        List<String> received = new ArrayList<>();
        collector.subscribe(entry -> {
            throw new IllegalStateException("boom");
        });
        collector.subscribe(entry -> received.add(entry.getId()));

        collector.collect(entry("A", 1));

        assertEquals(List.of("trace-1"), received);
        assertEquals(1, collector.size());
    }

    @Test
    void clearEmptiesTheBuffer() {
        MemoryCollector collector = collector(TraceRetentionPolicy.DEFAULT);
        collector.collect(entry("A", 1));

        collector.clear();

        assertTrue(collector.getTraces().isEmpty());
        assertEquals(0, collector.getStats().totalResolutions());
    }

    @Test
    void compositeAnswersQueriesFromFirstCollector() {
        MemoryCollector first = collector(TraceRetentionPolicy.DEFAULT);
        MemoryCollector second = collector(TraceRetentionPolicy.builder().maxTraces(1).build());
        CompositeCollector composite = CompositeCollector.of(first, second);

        composite.collect(entry("A", 1));
        composite.collect(entry("B", 1));

        assertEquals(2, composite.getTraces().size());
        assertEquals(1, second.size());
        assertEquals(2, composite.getStats().totalResolutions());

        composite.clear();
        assertEquals(0, first.size());
        assertEquals(TraceStats.EMPTY, CompositeCollector.of().getStats());
    }
}
