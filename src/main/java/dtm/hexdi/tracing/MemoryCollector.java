package dtm.hexdi.tracing;

import dtm.hexdi.common.TimeSource;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Coletor em memória com retenção limitada.
 * <ul>
 *   <li>traces com duração acima do limite de lentidão são fixados ao chegar;</li>
 *   <li>acima de {@code maxPinnedTraces} os fixados mais antigos são descartados;</li>
 *   <li>acima de {@code maxTraces} os não fixados mais antigos são descartados;</li>
 *   <li>não fixados mais velhos que {@code expiryMs} expiram na próxima consulta.</li>
 * </ul>
 * As estatísticas são recalculadas a partir do buffer a cada chamada.
 */
@Slf4j
public class MemoryCollector implements TraceCollector {

    private final List<StoredTrace> storedTraces = new ArrayList<>();
    private final Set<TraceSubscriber> subscribers = new CopyOnWriteArraySet<>();
    private final TraceRetentionPolicy retentionPolicy;
    private final TimeSource timeSource;
    private final long sessionStart;

    public MemoryCollector() {
        this(TraceRetentionPolicy.DEFAULT);
    }

    public MemoryCollector(TraceRetentionPolicy retentionPolicy) {
        this(retentionPolicy, TimeSource.SYSTEM);
    }

    public MemoryCollector(@NonNull TraceRetentionPolicy retentionPolicy, @NonNull TimeSource timeSource) {
        this.retentionPolicy = retentionPolicy;
        this.timeSource = timeSource;
        this.sessionStart = timeSource.currentTimeMillis();
    }

    @Override
    public void collect(@NonNull TraceEntry entry) {
        TraceEntry processed = entry.getDuration() >= retentionPolicy.getSlowThresholdMs()
                ? entry.withPinned(true)
                : entry;

        synchronized (storedTraces) {
            storedTraces.add(new StoredTrace(processed, timeSource.currentTimeMillis()));
            enforcePinnedLimit();
            enforceFifoLimit();
        }

        notifySubscribers(processed);
    }

    @Override
    public List<TraceEntry> getTraces(TraceFilter filter) {
        TraceFilter effective = filter == null ? TraceFilter.NONE : filter;
        synchronized (storedTraces) {
            applyTimeExpiry();
            List<TraceEntry> result = new ArrayList<>();
            for (StoredTrace stored : storedTraces) {
                if (effective.matches(stored.entry)) {
                    result.add(stored.entry);
                }
            }
            return List.copyOf(result);
        }
    }

    @Override
    public TraceStats getStats() {
        synchronized (storedTraces) {
            applyTimeExpiry();

            int total = storedTraces.size();
            if (total == 0) {
                return TraceStats.empty(sessionStart);
            }

            double totalDuration = 0;
            int cacheHits = 0;
            int slowCount = 0;
            for (StoredTrace stored : storedTraces) {
                TraceEntry trace = stored.entry;
                totalDuration += trace.getDuration();
                if (trace.isCacheHit()) cacheHits++;
                if (trace.getDuration() >= retentionPolicy.getSlowThresholdMs()) slowCount++;
            }

            return new TraceStats(
                    total,
                    totalDuration / total,
                    (double) cacheHits / total,
                    slowCount,
                    sessionStart,
                    totalDuration
            );
        }
    }

    @Override
    public void clear() {
        synchronized (storedTraces) {
            storedTraces.clear();
        }
    }

    @Override
    public Subscription subscribe(@NonNull TraceSubscriber subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    @Override
    public void pin(String traceId) {
        synchronized (storedTraces) {
            StoredTrace stored = find(traceId);
            if (stored != null && !stored.entry.isPinned()) {
                stored.entry = stored.entry.withPinned(true);
                enforcePinnedLimit();
            }
        }
    }

    @Override
    public void unpin(String traceId) {
        synchronized (storedTraces) {
            StoredTrace stored = find(traceId);
            if (stored != null && stored.entry.isPinned()) {
                stored.entry = stored.entry.withPinned(false);
            }
        }
    }

    public TraceRetentionPolicy getRetentionPolicy() {
        return retentionPolicy;
    }

    public int size() {
        synchronized (storedTraces) {
            return storedTraces.size();
        }
    }

    private StoredTrace find(String traceId) {
        for (StoredTrace stored : storedTraces) {
            if (stored.entry.getId().equals(traceId)) {
                return stored;
            }
        }
        return null;
    }

    private void enforcePinnedLimit() {
        long pinnedCount = storedTraces.stream().filter(stored -> stored.entry.isPinned()).count();
        long excess = pinnedCount - retentionPolicy.getMaxPinnedTraces();

        Iterator<StoredTrace> iterator = storedTraces.iterator();
        while (excess > 0 && iterator.hasNext()) {
            StoredTrace stored = iterator.next();
            if (stored.entry.isPinned()) {
                iterator.remove();
                excess--;
                log.debug("Trace fixado '{}' descartado pelo limite de fixados", stored.entry.getId());
            }
        }
    }

    private void enforceFifoLimit() {
        Iterator<StoredTrace> iterator = storedTraces.iterator();
        while (storedTraces.size() > retentionPolicy.getMaxTraces() && iterator.hasNext()) {
            if (!iterator.next().entry.isPinned()) {
                iterator.remove();
            }
        }
    }

    private void applyTimeExpiry() {
        long now = timeSource.currentTimeMillis();
        storedTraces.removeIf(stored -> !stored.entry.isPinned()
                && now - stored.collectedAt > retentionPolicy.getExpiryMs());
    }

    private void notifySubscribers(TraceEntry entry) {
        for (TraceSubscriber subscriber : subscribers) {
            try {
                subscriber.onTrace(entry);
            } catch (RuntimeException e) {
                log.error("Assinante de traces falhou ao receber '{}'", entry.getId(), e);
            }
        }
    }

    private static final class StoredTrace {
        private TraceEntry entry;
        private final long collectedAt;

        private StoredTrace(TraceEntry entry, long collectedAt) {
            this.entry = entry;
            this.collectedAt = collectedAt;
        }
    }
}
