package dtm.hexdi.storage.graph;

import dtm.hexdi.exceptions.DuplicateProviderException;
import dtm.hexdi.exceptions.MissingDependencyException;
import dtm.hexdi.prototypes.Adapter;
import dtm.hexdi.prototypes.Port;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Acumulador imutável de adapters.
 *
 * Cada chamada a {@link #provide(Adapter)} devolve um novo builder e nunca altera o atual,
 * o que permite ramificar a partir de um prefixo comum:
 *
 * <pre>{@code
 * GraphBuilder base = GraphBuilder.create().provide(loggerAdapter);
 * Graph withDb = base.provide(databaseAdapter).build();
 * Graph withMock = base.provide(mockDatabaseAdapter).build();
 * }</pre>
 *
 * A cada passo o builder conhece o conjunto de portas fornecidas e o de portas requeridas.
 * Provedores duplicados falham imediatamente; portas ausentes falham em {@link #build()}.
 * A validação depende apenas de pertinência a conjuntos, portanto a ordem das chamadas
 * não altera o resultado.
 */
@Slf4j
public final class GraphBuilder {

    private static final GraphBuilder EMPTY = new GraphBuilder(List.of(), Set.of(), Set.of());

    private final List<Adapter<?>> adapters;
    private final Set<String> providedPorts;
    private final Set<String> requiredPorts;

    private GraphBuilder(List<Adapter<?>> adapters, Set<String> providedPorts, Set<String> requiredPorts) {
        this.adapters = adapters;
        this.providedPorts = providedPorts;
        this.requiredPorts = requiredPorts;
    }

    public static GraphBuilder create() {
        return EMPTY;
    }

    /**
     * Registra um adapter.
     *
     * @return novo builder contendo o adapter
     * @throws DuplicateProviderException se a porta já possuir provedor
     */
    public GraphBuilder provide(@NonNull Adapter<?> adapter) {
        String portName = adapter.getPortName();
        if (providedPorts.contains(portName)) {
            throw new DuplicateProviderException(portName);
        }

        List<Adapter<?>> nextAdapters = new ArrayList<>(adapters.size() + 1);
        nextAdapters.addAll(adapters);
        nextAdapters.add(adapter);

        Set<String> nextProvided = new LinkedHashSet<>(providedPorts);
        nextProvided.add(portName);

        Set<String> nextRequired = new LinkedHashSet<>(requiredPorts);
        nextRequired.addAll(adapter.getRequiredPortNames());

        log.debug("Adapter registrado: {} ({}) requer {}", portName, adapter.getLifetime(), adapter.getRequiredPortNames());

        return new GraphBuilder(
                Collections.unmodifiableList(nextAdapters),
                Collections.unmodifiableSet(nextProvided),
                Collections.unmodifiableSet(nextRequired)
        );
    }

    public GraphBuilder provideAll(@NonNull Adapter<?>... adapters) {
        return provideAll(List.of(adapters));
    }

    public GraphBuilder provideAll(@NonNull Iterable<? extends Adapter<?>> adapters) {
        GraphBuilder builder = this;
        for (Adapter<?> adapter : adapters) {
            builder = builder.provide(adapter);
        }
        return builder;
    }

    /**
     * Junta os adapters de outro builder a este, com a mesma detecção de duplicados.
     */
    public GraphBuilder merge(@NonNull GraphBuilder other) {
        return provideAll(other.adapters);
    }

    /**
     * Valida o grafo e o congela.
     *
     * @throws MissingDependencyException listando todas as portas requeridas sem provedor
     */
    public Graph build() {
        Set<String> missing = getMissingPorts();
        if (!missing.isEmpty()) {
            log.warn("Grafo incompleto, portas sem provedor: {}", missing);
            throw new MissingDependencyException(missing);
        }
        log.info("Grafo construído com {} adapter(s)", adapters.size());
        return new Graph(adapters);
    }

    public Set<String> getProvidedPorts() {
        return providedPorts;
    }

    public Set<String> getRequiredPorts() {
        return requiredPorts;
    }

    /**
     * Portas requeridas menos portas fornecidas, em ordem alfabética.
     */
    public Set<String> getMissingPorts() {
        Set<String> missing = new TreeSet<>(requiredPorts);
        missing.removeAll(providedPorts);
        return Collections.unmodifiableSet(missing);
    }

    public boolean isComplete() {
        return providedPorts.containsAll(requiredPorts);
    }

    public boolean provides(@NonNull Port<?> port) {
        return providedPorts.contains(port.getName());
    }

    public List<Adapter<?>> getAdapters() {
        return adapters;
    }

    public int size() {
        return adapters.size();
    }
}
