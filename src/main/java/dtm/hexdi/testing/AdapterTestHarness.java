package dtm.hexdi.testing;

import dtm.hexdi.exceptions.DependencyContainerException;
import dtm.hexdi.exceptions.FactoryException;
import dtm.hexdi.prototypes.Adapter;
import dtm.hexdi.prototypes.Finalizer;
import dtm.hexdi.prototypes.Port;
import dtm.hexdi.prototypes.ResolvedDependencies;
import lombok.NonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executa a factory de um único adapter, fora de qualquer contêiner, com
 * dependências fornecidas pelo teste.
 *
 * @param <T> tipo do serviço do adapter
 */
public final class AdapterTestHarness<T> {

    private final Adapter<T> adapter;
    private final ResolvedDependencies dependencies;

    private AdapterTestHarness(Adapter<T> adapter, ResolvedDependencies dependencies) {
        this.adapter = adapter;
        this.dependencies = dependencies;
    }

    /**
     * @throws IllegalArgumentException se alguma porta requerida não tiver mock
     */
    public static <T> AdapterTestHarness<T> of(@NonNull Adapter<T> adapter, @NonNull Map<String, ?> mockDependencies) {
        for (String portName : adapter.getRequiredPortNames()) {
            if (!mockDependencies.containsKey(portName)) {
                throw new IllegalArgumentException("Missing mock for required port '" + portName + "'");
            }
        }
        return new AdapterTestHarness<>(adapter, ResolvedDependencies.of(mockDependencies));
    }

    public static <T> AdapterTestHarness<T> of(Adapter<T> adapter) {
        return of(adapter, Map.of());
    }

    public static <T> Builder<T> builder(@NonNull Adapter<T> adapter) {
        return new Builder<>(adapter);
    }

    public T invoke() {
        try {
            return adapter.getFactory().create(dependencies);
        } catch (DependencyContainerException e) {
            throw e;
        } catch (Exception e) {
            throw new FactoryException(adapter.getPortName(), e);
        }
    }

    /**
     * Executa o finalizer do adapter sobre {@code instance}; sem finalizer, conclui imediatamente.
     */
    public CompletableFuture<Void> release(T instance) {
        Finalizer<T> finalizer = adapter.getFinalizer();
        if (finalizer == null) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            return finalizer.release(instance).toCompletableFuture();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public ResolvedDependencies getDeps() {
        return dependencies;
    }

    public Adapter<T> getAdapter() {
        return adapter;
    }

    public static final class Builder<T> {

        private final Adapter<T> adapter;
        private final Map<String, Object> mocks = new LinkedHashMap<>();

        private Builder(Adapter<T> adapter) {
            this.adapter = adapter;
        }

        public <D> Builder<T> mock(@NonNull Port<D> port, @NonNull D instance) {
            mocks.put(port.getName(), instance);
            return this;
        }

        public AdapterTestHarness<T> build() {
            return AdapterTestHarness.of(adapter, mocks);
        }
    }
}
