package dtm.hexdi.storage.graph;

import dtm.hexdi.exceptions.UnknownPortException;
import dtm.hexdi.prototypes.Adapter;
import dtm.hexdi.prototypes.Lifetime;
import dtm.hexdi.prototypes.Port;
import lombok.NonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class Graph {

    private final List<Adapter<?>> adapters;
    private final Map<String, Adapter<?>> adaptersByPort;

    Graph(List<Adapter<?>> adapters) {
        this.adapters = List.copyOf(adapters);
        Map<String, Adapter<?>> index = new LinkedHashMap<>();
        for (Adapter<?> adapter : this.adapters) {
            index.put(adapter.getPortName(), adapter);
        }
        this.adaptersByPort = Collections.unmodifiableMap(index);
    }

    public List<Adapter<?>> getAdapters() {
        return adapters;
    }

    public Optional<Adapter<?>> findAdapter(@NonNull String portName) {
        return Optional.ofNullable(adaptersByPort.get(portName));
    }

    public Adapter<?> getAdapter(@NonNull String portName) {
        Adapter<?> adapter = adaptersByPort.get(portName);
        if (adapter == null) {
            throw new UnknownPortException(portName);
        }
        return adapter;
    }

    @SuppressWarnings("unchecked")
    public <T> Adapter<T> getAdapter(@NonNull Port<T> port) {
        return (Adapter<T>) getAdapter(port.getName());
    }

    public boolean contains(@NonNull Port<?> port) {
        return adaptersByPort.containsKey(port.getName());
    }

    public boolean contains(@NonNull String portName) {
        return adaptersByPort.containsKey(portName);
    }

    public Set<String> getPortNames() {
        return adaptersByPort.keySet();
    }

    public long count(@NonNull Lifetime lifetime) {
        return adapters.stream().filter(adapter -> adapter.getLifetime() == lifetime).count();
    }

    public int size() {
        return adapters.size();
    }

    public boolean isEmpty() {
        return adapters.isEmpty();
    }

    public List<Set<String>> getDependencyLayers() {
        return new GraphLayerResolver(this).resolveLayers();
    }

    @Override
    public String toString() {
        return "Graph" + adaptersByPort.keySet();
    }
}
