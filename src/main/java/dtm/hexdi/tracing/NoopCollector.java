package dtm.hexdi.tracing;

import java.util.List;

public final class NoopCollector implements TraceCollector {

    public static final NoopCollector INSTANCE = new NoopCollector();

    private NoopCollector() {
    }

    @Override
    public void collect(TraceEntry entry) {
    }

    @Override
    public List<TraceEntry> getTraces(TraceFilter filter) {
        return List.of();
    }

    @Override
    public TraceStats getStats() {
        return TraceStats.EMPTY;
    }

    @Override
    public void clear() {
    }

    @Override
    public Subscription subscribe(TraceSubscriber subscriber) {
        return Subscription.NONE;
    }
}
