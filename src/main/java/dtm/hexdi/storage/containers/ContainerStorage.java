package dtm.hexdi.storage.containers;

import dtm.hexdi.common.StopWatch;
import dtm.hexdi.common.TimeSource;
import dtm.hexdi.core.Container;
import dtm.hexdi.core.ContainerInspector;
import dtm.hexdi.core.ContainerOptions;
import dtm.hexdi.core.ResolutionHooks;
import dtm.hexdi.core.ScopedResolutionPolicy;
import dtm.hexdi.exceptions.DependencyContainerException;
import dtm.hexdi.exceptions.FactoryException;
import dtm.hexdi.exceptions.ScopeRequiredException;
import dtm.hexdi.prototypes.Adapter;
import dtm.hexdi.prototypes.Port;
import dtm.hexdi.prototypes.ResolutionHookContext;
import dtm.hexdi.prototypes.ResolutionResultContext;
import dtm.hexdi.prototypes.ResolvedDependencies;
import dtm.hexdi.storage.graph.Graph;
import dtm.hexdi.storage.memo.MemoMap;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
public final class ContainerStorage extends AbstractResolverStorage implements Container {

    public static final String ROOT_ID = "container";

    private final Graph graph;
    private final ContainerOptions options;
    private final ResolutionHooks hooks;
    private final TimeSource timeSource;
    private final AtomicLong resolutionCounter;
    private final AtomicLong scopeCounter = new AtomicLong(0);
    private final MemoMap singletonMemo;
    private final ReentrantLock resolutionLock = new ReentrantLock();
    private final ThreadLocal<ResolutionContext> resolutionContext = ThreadLocal.withInitial(ResolutionContext::new);
    private final ContainerInspector inspector;

    private ContainerStorage(Graph graph, ContainerOptions options, AtomicLong resolutionCounter) {
        super(ROOT_ID, null, new MemoMap(resolutionCounter, options.getTimeSource()));
        this.graph = graph;
        this.options = options;
        this.hooks = options.getHooks();
        this.timeSource = options.getTimeSource();
        this.resolutionCounter = resolutionCounter;
        this.singletonMemo = new MemoMap(resolutionCounter, timeSource);
        this.inspector = new ContainerInspectorStorage(this);
    }

    public static ContainerStorage create(@NonNull Graph graph) {
        return create(graph, ContainerOptions.DEFAULT);
    }

    public static ContainerStorage create(@NonNull Graph graph, @NonNull ContainerOptions options) {
        ContainerStorage container = new ContainerStorage(graph, options, new AtomicLong(0));
        log.info("Contêiner criado com {} adapter(s), política scoped {}", graph.size(), options.getScopedResolutionPolicy());
        return container;
    }

    @Override
    ContainerStorage root() {
        return this;
    }

    @Override
    boolean isRoot() {
        return true;
    }

    @Override
    public Graph getGraph() {
        return graph;
    }

    @Override
    public ContainerInspector inspector() {
        return inspector;
    }

    public ContainerOptions getOptions() {
        return options;
    }

    <T> T resolveFrom(AbstractResolverStorage requester, Port<T> port) {
        Adapter<T> adapter = graph.getAdapter(port);

        resolutionLock.lock();
        try {
            return resolveWithAdapter(requester, adapter, null, 0);
        } finally {
            if (resolutionContext.get().isEmpty()) {
                resolutionContext.remove();
            }
            resolutionLock.unlock();
        }
    }

    private <T> T resolveWithAdapter(AbstractResolverStorage requester, Adapter<T> adapter, Port<?> parentPort, int depth) {
        MemoMap memo = selectMemo(requester, adapter);
        boolean cacheHit = memo != null && memo.has(adapter.getPortName());

        ResolutionHookContext context = new ResolutionHookContext(
                adapter.getProvides(),
                adapter.getLifetime(),
                requester.hookScopeId(),
                parentPort,
                cacheHit,
                depth
        );
        StopWatch stopWatch = StopWatch.start(timeSource);
        T instance;
        try {
            hooks.beforeResolve(context);
            instance = (memo == null)
                    ? createInstance(requester, adapter, depth)
                    : memo.getOrElseMemoize(adapter, () -> createInstance(requester, adapter, depth));
        } catch (RuntimeException e) {
            stopWatch.stop();
            try {
                hooks.afterResolve(new ResolutionResultContext(context, stopWatch.getElapsedMillis(), e));
            } catch (RuntimeException hookError) {
                e.addSuppressed(hookError);
            }
            throw e;
        }
        stopWatch.stop();

        if (log.isDebugEnabled()) {
            log.debug("'{}' resolvido em '{}' ({}, {}, {} ms)",
                    adapter.getPortName(), requester.getId(), adapter.getLifetime(),
                    cacheHit ? "cache" : "novo", stopWatch.getElapsedMillis());
        }
        hooks.afterResolve(new ResolutionResultContext(context, stopWatch.getElapsedMillis(), null));
        return instance;
    }

    private MemoMap selectMemo(AbstractResolverStorage requester, Adapter<?> adapter) {
        return switch (adapter.getLifetime()) {
            case SINGLETON -> singletonMemo;
            case SCOPED -> {
                if (requester.isRoot() && options.getScopedResolutionPolicy() == ScopedResolutionPolicy.REJECT) {
                    throw new ScopeRequiredException(adapter.getPortName());
                }
                yield requester.getScopedMemo();
            }
            case REQUEST -> null;
        };
    }

    private <T> T createInstance(AbstractResolverStorage requester, Adapter<T> adapter, int depth) {
        String portName = adapter.getPortName();
        ResolutionContext context = resolutionContext.get();
        context.enter(portName);
        try {
            Map<String, Object> dependencies = new LinkedHashMap<>();
            for (Port<?> required : adapter.getRequires()) {
                Adapter<?> requiredAdapter = graph.getAdapter(required.getName());
                dependencies.put(required.getName(), resolveWithAdapter(requester, requiredAdapter, adapter.getProvides(), depth + 1));
            }

            try {
                return adapter.getFactory().create(ResolvedDependencies.of(dependencies));
            } catch (DependencyContainerException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Factory da porta '{}' falhou: {}", portName, e.getMessage());
                throw new FactoryException(portName, e);
            }
        } finally {
            context.exit(portName);
        }
    }

    @Override
    CompletableFuture<List<Throwable>> disposeOwnInstances() {
        return super.disposeOwnInstances().thenCompose(scopedErrors -> singletonMemo.dispose().thenApply(singletonErrors -> {
            List<Throwable> errors = new ArrayList<>(scopedErrors);
            errors.addAll(singletonErrors);
            return errors;
        }));
    }

    @Override
    void onDisposed() {
        log.info("Contêiner descartado");
    }

    String nextScopeId() {
        return "scope-" + scopeCounter.getAndIncrement();
    }

    MemoMap getSingletonMemo() {
        return singletonMemo;
    }

    AtomicLong getResolutionCounter() {
        return resolutionCounter;
    }

    TimeSource getTimeSource() {
        return timeSource;
    }

    @Override
    public String toString() {
        return "Container" + graph.getPortNames();
    }
}
