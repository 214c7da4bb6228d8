package dtm.hexdi.tracing;

import java.util.List;

/**
 * Destino dos traces produzidos pelo contêiner com tracing.
 */
public interface TraceCollector {

    void collect(TraceEntry entry);

    List<TraceEntry> getTraces(TraceFilter filter);

    default List<TraceEntry> getTraces() {
        return getTraces(TraceFilter.NONE);
    }

    TraceStats getStats();

    void clear();

    Subscription subscribe(TraceSubscriber subscriber);

    default void pin(String traceId) {
    }

    default void unpin(String traceId) {
    }
}
