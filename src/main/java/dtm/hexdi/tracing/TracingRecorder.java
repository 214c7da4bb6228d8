package dtm.hexdi.tracing;

import dtm.hexdi.common.TimeSource;
import dtm.hexdi.core.ResolutionHooks;
import dtm.hexdi.prototypes.ResolutionHookContext;
import dtm.hexdi.prototypes.ResolutionResultContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
final class TracingRecorder implements ResolutionHooks, TracingApi {

    private final TraceCollector collector;
    private final TimeSource timeSource;
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicLong traceIdCounter = new AtomicLong(0);
    private final AtomicLong orderCounter = new AtomicLong(0);
    private final ThreadLocal<Deque<ActiveTrace>> traceStack = ThreadLocal.withInitial(ArrayDeque::new);

    TracingRecorder(TraceCollector collector, TimeSource timeSource) {
        this.collector = collector;
        this.timeSource = timeSource;
    }

    @Override
    public void beforeResolve(ResolutionHookContext context) {
        Deque<ActiveTrace> stack = traceStack.get();

        if (paused.get()) {
            stack.push(ActiveTrace.SKIPPED);
            return;
        }

        ActiveTrace parent = stack.peek();
        String parentTraceId = parent != null && parent.recorded() ? parent.traceId() : null;
        ActiveTrace active = new ActiveTrace(
                "trace-" + traceIdCounter.incrementAndGet(),
                parentTraceId,
                timeSource.currentTimeMillis(),
                new ArrayList<>(),
                true
        );

        if (parentTraceId != null) {
            parent.childTraceIds().add(active.traceId());
        }
        stack.push(active);
    }

    @Override
    public void afterResolve(ResolutionResultContext context) {
        Deque<ActiveTrace> stack = traceStack.get();
        ActiveTrace active = stack.poll();
        if (stack.isEmpty()) {
            traceStack.remove();
        }

        if (active == null || !active.recorded()) {
            return;
        }

        TraceEntry entry = TraceEntry.builder()
                .id(active.traceId())
                .portName(context.portName())
                .lifetime(context.lifetime())
                .startTime(active.startTime())
                .duration(context.durationMillis())
                .cacheHit(context.cacheHit())
                .parentTraceId(active.parentTraceId())
                .childTraceIds(List.copyOf(active.childTraceIds()))
                .scopeId(context.scopeId())
                .order(orderCounter.incrementAndGet())
                .pinned(false)
                .build();

        if (context.failed()) {
            log.debug("Trace '{}' registrado para resolução com falha de '{}'", entry.getId(), entry.getPortName());
        }
        collector.collect(entry);
    }

    @Override
    public List<TraceEntry> getTraces() {
        return collector.getTraces();
    }

    @Override
    public List<TraceEntry> getTraces(TraceFilter filter) {
        return collector.getTraces(filter);
    }

    @Override
    public TraceStats getStats() {
        return collector.getStats();
    }

    @Override
    public void pause() {
        paused.set(true);
    }

    @Override
    public void resume() {
        paused.set(false);
    }

    @Override
    public boolean isPaused() {
        return paused.get();
    }

    @Override
    public void clear() {
        collector.clear();
        traceIdCounter.set(0);
        orderCounter.set(0);
    }

    @Override
    public Subscription subscribe(TraceSubscriber subscriber) {
        return collector.subscribe(subscriber);
    }

    @Override
    public void pin(String traceId) {
        collector.pin(traceId);
    }

    @Override
    public void unpin(String traceId) {
        collector.unpin(traceId);
    }

    TraceCollector getCollector() {
        return collector;
    }

    private record ActiveTrace(
            String traceId,
            String parentTraceId,
            long startTime,
            List<String> childTraceIds,
            boolean recorded
    ) {
        static final ActiveTrace SKIPPED = new ActiveTrace(null, null, 0, List.of(), false);
    }
}
