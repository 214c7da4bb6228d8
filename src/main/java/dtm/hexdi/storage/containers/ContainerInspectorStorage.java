package dtm.hexdi.storage.containers;

import dtm.hexdi.core.ContainerInspector;
import dtm.hexdi.exceptions.DisposedResolverException;
import dtm.hexdi.exceptions.UnknownPortException;
import dtm.hexdi.prototypes.Adapter;
import dtm.hexdi.prototypes.Lifetime;
import dtm.hexdi.prototypes.ResolutionStatus;
import dtm.hexdi.prototypes.inspector.ContainerSnapshot;
import dtm.hexdi.prototypes.inspector.MemoEntry;
import dtm.hexdi.prototypes.inspector.ScopeStatus;
import dtm.hexdi.prototypes.inspector.ScopeTree;
import dtm.hexdi.prototypes.inspector.SingletonEntry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class ContainerInspectorStorage implements ContainerInspector {

    private final ContainerStorage container;

    ContainerInspectorStorage(ContainerStorage container) {
        this.container = container;
    }

    @Override
    public ContainerSnapshot snapshot() {
        throwIfDisposed();

        Map<String, MemoEntry> resolved = new HashMap<>();
        for (MemoEntry entry : container.getSingletonMemo().entries()) {
            resolved.put(entry.portName(), entry);
        }

        List<SingletonEntry> singletons = new ArrayList<>();
        for (Adapter<?> adapter : container.getGraph().getAdapters()) {
            if (adapter.getLifetime() != Lifetime.SINGLETON) continue;

            MemoEntry entry = resolved.get(adapter.getPortName());
            singletons.add(new SingletonEntry(
                    adapter.getPortName(),
                    adapter.getLifetime(),
                    entry != null,
                    entry != null ? entry.resolvedAt() : null,
                    entry != null ? entry.resolutionOrder() : null
            ));
        }

        return new ContainerSnapshot(container.isDisposed(), singletons, buildTree());
    }

    @Override
    public ScopeTree getScopeTree() {
        throwIfDisposed();
        return buildTree();
    }

    @Override
    public ResolutionStatus isResolved(String portName) {
        throwIfDisposed();
        Adapter<?> adapter = container.getGraph().findAdapter(portName)
                .orElseThrow(() -> new UnknownPortException(portName));
        return container.isResolved(adapter.getProvides());
    }

    @Override
    public List<String> listPorts() {
        throwIfDisposed();
        return container.getGraph().getPortNames().stream().sorted().toList();
    }

    private ScopeTree buildTree() {
        int scopedCount = (int) container.getGraph().count(Lifetime.SCOPED);
        List<ScopeTree> children = new ArrayList<>();
        for (ScopeStorage child : container.getChildren()) {
            children.add(buildNode(child, scopedCount));
        }
        return new ScopeTree(
                ContainerStorage.ROOT_ID,
                status(container),
                container.getSingletonMemo().size(),
                container.getGraph().size(),
                children
        );
    }

    private ScopeTree buildNode(ScopeStorage scope, int scopedCount) {
        List<ScopeTree> children = new ArrayList<>();
        for (ScopeStorage child : scope.getChildren()) {
            children.add(buildNode(child, scopedCount));
        }
        return new ScopeTree(scope.getId(), status(scope), scope.getScopedMemo().size(), scopedCount, children);
    }

    private ScopeStatus status(AbstractResolverStorage resolver) {
        return resolver.isActive() ? ScopeStatus.ACTIVE : ScopeStatus.DISPOSED;
    }

    private void throwIfDisposed() {
        if (!container.isActive()) {
            throw new DisposedResolverException(ContainerStorage.ROOT_ID, "inspect");
        }
    }

}
