package dtm.hexdi.storage.containers;

import dtm.hexdi.core.Resolver;
import dtm.hexdi.core.Scope;
import dtm.hexdi.exceptions.DisposedResolverException;
import dtm.hexdi.exceptions.FinalizerException;
import dtm.hexdi.prototypes.Adapter;
import dtm.hexdi.prototypes.Lifetime;
import dtm.hexdi.prototypes.Port;
import dtm.hexdi.prototypes.ResolutionStatus;
import dtm.hexdi.storage.memo.MemoMap;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
abstract class AbstractResolverStorage implements Resolver {

    private final String id;
    private final AbstractResolverStorage parent;
    private final MemoMap scopedMemo;
    private final Set<ScopeStorage> children = Collections.synchronizedSet(new LinkedHashSet<>());
    private final AtomicReference<ResolverState> state = new AtomicReference<>(ResolverState.ACTIVE);
    private final AtomicReference<CompletableFuture<List<Throwable>>> disposal = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<Void>> publicDisposal = new AtomicReference<>();

    AbstractResolverStorage(String id, AbstractResolverStorage parent, MemoMap scopedMemo) {
        this.id = id;
        this.parent = parent;
        this.scopedMemo = scopedMemo;
    }

    abstract ContainerStorage root();

    @Override
    public String getId() {
        return id;
    }

    @Override
    public <T> T resolve(@NonNull Port<T> port) {
        throwIfNotActive(port.getName());
        return root().resolveFrom(this, port);
    }

    @Override
    public Scope createScope() {
        ScopeStorage child;
        synchronized (children) {
            if (state.get() != ResolverState.ACTIVE) {
                throw new DisposedResolverException(id, "create a scope");
            }
            child = new ScopeStorage(root(), this, root().nextScopeId());
            children.add(child);
        }
        log.debug("Escopo '{}' criado a partir de '{}'", child.getId(), id);
        return child;
    }

    @Override
    public CompletableFuture<Void> dispose() {
        CompletableFuture<Void> existing = publicDisposal.get();
        if (existing != null) {
            return existing;
        }

        CompletableFuture<Void> result = disposeInternal().thenCompose(errors -> errors.isEmpty()
                ? CompletableFuture.<Void>completedFuture(null)
                : CompletableFuture.<Void>failedFuture(new FinalizerException(errors)));

        if (publicDisposal.compareAndSet(null, result)) {
            return result;
        }
        return publicDisposal.get();
    }

    CompletableFuture<List<Throwable>> disposeInternal() {
        CompletableFuture<List<Throwable>> pending = new CompletableFuture<>();
        if (!disposal.compareAndSet(null, pending)) {
            return disposal.get();
        }

        // escopos criados depois deste ponto são recusados, então o snapshot está completo
        List<ScopeStorage> snapshot;
        synchronized (children) {
            state.set(ResolverState.DISPOSING);
            snapshot = new ArrayList<>(children);
        }
        log.debug("Descartando '{}'", id);

        CompletableFuture<List<Throwable>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (ScopeStorage child : snapshot) {
            chain = chain.thenCompose(errors -> child.disposeInternal().thenApply(childErrors -> {
                errors.addAll(childErrors);
                return errors;
            }));
        }

        chain.thenCompose(errors -> disposeOwnInstances().thenApply(ownErrors -> {
                    errors.addAll(ownErrors);
                    return errors;
                }))
                .whenComplete((errors, failure) -> {
                    state.set(ResolverState.DISPOSED);
                    children.clear();
                    if (parent != null) {
                        parent.children.remove(this);
                    }
                    onDisposed();
                    if (failure != null) {
                        pending.completeExceptionally(failure);
                    } else {
                        pending.complete(List.copyOf(errors));
                    }
                });

        return pending;
    }

    CompletableFuture<List<Throwable>> disposeOwnInstances() {
        return scopedMemo.dispose();
    }

    void onDisposed() {
        log.debug("'{}' descartado", id);
    }

    @Override
    public boolean isDisposed() {
        return state.get() == ResolverState.DISPOSED;
    }

    boolean isActive() {
        return state.get() == ResolverState.ACTIVE;
    }

    @Override
    public ResolutionStatus isResolved(@NonNull Port<?> port) {
        throwIfNotActive(port.getName());
        Adapter<?> adapter = root().getGraph().getAdapter(port.getName());
        return switch (adapter.getLifetime()) {
            case SINGLETON -> root().getSingletonMemo().has(port.getName())
                    ? ResolutionStatus.RESOLVED
                    : ResolutionStatus.UNRESOLVED;
            case SCOPED -> {
                if (isRoot()) {
                    yield ResolutionStatus.SCOPE_REQUIRED;
                }
                yield scopedMemo.has(port.getName()) ? ResolutionStatus.RESOLVED : ResolutionStatus.UNRESOLVED;
            }
            case REQUEST -> ResolutionStatus.UNRESOLVED;
        };
    }

    @Override
    public boolean requiresScope(@NonNull Port<?> port) {
        Adapter<?> adapter = root().getGraph().getAdapter(port.getName());
        return adapter.getLifetime() == Lifetime.SCOPED && isRoot();
    }

    abstract boolean isRoot();

    String hookScopeId() {
        return isRoot() ? null : id;
    }

    MemoMap getScopedMemo() {
        return scopedMemo;
    }

    AbstractResolverStorage getParentStorage() {
        return parent;
    }

    List<ScopeStorage> getChildren() {
        synchronized (children) {
            return List.copyOf(children);
        }
    }

    void throwIfNotActive(String portName) {
        if (state.get() != ResolverState.ACTIVE) {
            log.warn("Operação rejeitada em '{}': resolvedor descartado (porta '{}')", id, portName);
            throw new DisposedResolverException(portName);
        }
    }
}
