package dtm.hexdi.storage.memo;

import dtm.hexdi.common.TimeSource;
import dtm.hexdi.exceptions.DisposedResolverException;
import dtm.hexdi.prototypes.Adapter;
import dtm.hexdi.prototypes.Finalizer;
import dtm.hexdi.prototypes.inspector.MemoEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

@Slf4j
public class MemoMap {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Object> cache = new HashMap<>();
    private final List<CreationEntry<?>> creationOrder = new ArrayList<>();
    private final AtomicLong resolutionCounter;
    private final TimeSource timeSource;
    private boolean disposed;

    public MemoMap(AtomicLong resolutionCounter, TimeSource timeSource) {
        this.resolutionCounter = resolutionCounter;
        this.timeSource = timeSource;
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrElseMemoize(Adapter<T> adapter, Supplier<T> factory) {
        String portName = adapter.getPortName();

        lock.lock();
        try {
            throwIfDisposed(portName);
            if (cache.containsKey(portName)) {
                return (T) cache.get(portName);
            }
        } finally {
            lock.unlock();
        }

        T instance = factory.get();

        lock.lock();
        try {
            throwIfDisposed(portName);
            if (cache.containsKey(portName)) {
                return (T) cache.get(portName);
            }
            cache.put(portName, instance);
            creationOrder.add(new CreationEntry<>(
                    adapter,
                    instance,
                    timeSource.currentTimeMillis(),
                    resolutionCounter.incrementAndGet()
            ));
            return instance;
        } finally {
            lock.unlock();
        }
    }

    public boolean has(String portName) {
        lock.lock();
        try {
            return cache.containsKey(portName);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return cache.size();
        } finally {
            lock.unlock();
        }
    }

    public List<MemoEntry> entries() {
        lock.lock();
        try {
            List<MemoEntry> entries = new ArrayList<>(creationOrder.size());
            for (CreationEntry<?> entry : creationOrder) {
                entries.add(new MemoEntry(
                        entry.adapter().getPortName(),
                        entry.adapter().getLifetime(),
                        entry.resolvedAt(),
                        entry.resolutionOrder()
                ));
            }
            return Collections.unmodifiableList(entries);
        } finally {
            lock.unlock();
        }
    }

    public boolean isDisposed() {
        lock.lock();
        try {
            return disposed;
        } finally {
            lock.unlock();
        }
    }

    public CompletableFuture<List<Throwable>> dispose() {
        List<CreationEntry<?>> toFinalize;
        lock.lock();
        try {
            if (disposed) {
                return CompletableFuture.completedFuture(List.of());
            }
            disposed = true;
            toFinalize = new ArrayList<>(creationOrder);
            creationOrder.clear();
            cache.clear();
        } finally {
            lock.unlock();
        }

        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);

        for (int i = toFinalize.size() - 1; i >= 0; i--) {
            CreationEntry<?> entry = toFinalize.get(i);
            if (!entry.adapter().hasFinalizer()) continue;

            chain = chain.thenCompose(ignored -> runFinalizer(entry)
                    .handle((result, error) -> {
                        if (error != null) {
                            Throwable cause = unwrap(error);
                            log.warn("Finalizer da porta '{}' falhou: {}", entry.adapter().getPortName(), cause.getMessage());
                            errors.add(cause);
                        }
                        return null;
                    }));
        }

        return chain.thenApply(ignored -> List.copyOf(errors));
    }

    private <T> CompletableFuture<Void> runFinalizer(CreationEntry<T> entry) {
        Finalizer<T> finalizer = entry.adapter().getFinalizer();
        try {
            CompletionStage<Void> stage = finalizer.release(entry.instance());
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return stage.toCompletableFuture();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private void throwIfDisposed(String portName) {
        if (disposed) {
            throw new DisposedResolverException(portName);
        }
    }

    private record CreationEntry<T>(Adapter<T> adapter, T instance, long resolvedAt, long resolutionOrder) {
    }
}
