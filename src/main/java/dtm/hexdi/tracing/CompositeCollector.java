package dtm.hexdi.tracing;

import lombok.NonNull;

import java.util.List;

public class CompositeCollector implements TraceCollector {

    private final List<TraceCollector> collectors;

    public CompositeCollector(@NonNull List<? extends TraceCollector> collectors) {
        this.collectors = List.copyOf(collectors);
    }

    public static CompositeCollector of(TraceCollector... collectors) {
        return new CompositeCollector(List.of(collectors));
    }

    @Override
    public void collect(TraceEntry entry) {
        for (TraceCollector collector : collectors) {
            collector.collect(entry);
        }
    }

    @Override
    public List<TraceEntry> getTraces(TraceFilter filter) {
        return collectors.isEmpty() ? List.of() : collectors.get(0).getTraces(filter);
    }

    @Override
    public TraceStats getStats() {
        return collectors.isEmpty() ? TraceStats.EMPTY : collectors.get(0).getStats();
    }

    @Override
    public void clear() {
        collectors.forEach(TraceCollector::clear);
    }

    @Override
    public Subscription subscribe(TraceSubscriber subscriber) {
        return collectors.isEmpty() ? Subscription.NONE : collectors.get(0).subscribe(subscriber);
    }

    @Override
    public void pin(String traceId) {
        collectors.forEach(collector -> collector.pin(traceId));
    }

    @Override
    public void unpin(String traceId) {
        collectors.forEach(collector -> collector.unpin(traceId));
    }

    public List<TraceCollector> getCollectors() {
        return collectors;
    }
}
