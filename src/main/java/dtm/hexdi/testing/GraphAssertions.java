package dtm.hexdi.testing;

import dtm.hexdi.exceptions.GraphAssertionException;
import dtm.hexdi.prototypes.Adapter;
import dtm.hexdi.prototypes.Lifetime;
import dtm.hexdi.prototypes.Port;
import dtm.hexdi.storage.graph.Graph;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Asserções sobre a estrutura de um {@link Graph}, lançando {@link GraphAssertionException}.
 */
public final class GraphAssertions {

    private GraphAssertions() {
    }

    public static void assertComplete(@NonNull Graph graph) {
        Set<String> provided = graph.getPortNames();
        Set<String> missing = new TreeSet<>();
        for (Adapter<?> adapter : graph.getAdapters()) {
            for (String required : adapter.getRequiredPortNames()) {
                if (!provided.contains(required)) {
                    missing.add(required);
                }
            }
        }

        if (!missing.isEmpty()) {
            throw new GraphAssertionException(
                    "Graph incomplete. Missing ports: " + String.join(", ", missing),
                    new ArrayList<>(missing));
        }
    }

    public static void assertPortProvided(@NonNull Graph graph, @NonNull Port<?> port) {
        requireAdapter(graph, port);
    }

    public static void assertLifetime(@NonNull Graph graph, @NonNull Port<?> port, @NonNull Lifetime expected) {
        Adapter<?> adapter = requireAdapter(graph, port);
        if (adapter.getLifetime() != expected) {
            throw new GraphAssertionException(
                    "Port '" + port.getName() + "' has lifetime '" + adapter.getLifetime()
                            + "', expected '" + expected + "'",
                    List.of(port.getName()));
        }
    }

    private static Adapter<?> requireAdapter(Graph graph, Port<?> port) {
        return graph.findAdapter(port.getName()).orElseThrow(() -> new GraphAssertionException(
                "Port '" + port.getName() + "' is not provided in graph",
                List.of(port.getName())));
    }
}
