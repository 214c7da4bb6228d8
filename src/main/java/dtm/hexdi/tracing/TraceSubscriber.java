package dtm.hexdi.tracing;

@FunctionalInterface
public interface TraceSubscriber {
    void onTrace(TraceEntry entry);
}
