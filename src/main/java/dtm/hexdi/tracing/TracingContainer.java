package dtm.hexdi.tracing;

import dtm.hexdi.core.Container;
import dtm.hexdi.core.ContainerInspector;
import dtm.hexdi.core.Scope;
import dtm.hexdi.prototypes.Port;
import dtm.hexdi.prototypes.ResolutionStatus;
import dtm.hexdi.storage.graph.Graph;

import java.util.concurrent.CompletableFuture;

public final class TracingContainer implements Container {

    private final Container delegate;
    private final TracingRecorder recorder;

    TracingContainer(Container delegate, TracingRecorder recorder) {
        this.delegate = delegate;
        this.recorder = recorder;
    }

    public TracingApi tracing() {
        return recorder;
    }

    @Override
    public String getId() {
        return delegate.getId();
    }

    @Override
    public <T> T resolve(Port<T> port) {
        return delegate.resolve(port);
    }

    @Override
    public Scope createScope() {
        return delegate.createScope();
    }

    @Override
    public CompletableFuture<Void> dispose() {
        return delegate.dispose();
    }

    @Override
    public boolean isDisposed() {
        return delegate.isDisposed();
    }

    @Override
    public ResolutionStatus isResolved(Port<?> port) {
        return delegate.isResolved(port);
    }

    @Override
    public boolean requiresScope(Port<?> port) {
        return delegate.requiresScope(port);
    }

    @Override
    public Graph getGraph() {
        return delegate.getGraph();
    }

    @Override
    public ContainerInspector inspector() {
        return delegate.inspector();
    }

    @Override
    public String toString() {
        return "Tracing" + delegate;
    }
}
