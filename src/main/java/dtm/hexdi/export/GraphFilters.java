package dtm.hexdi.export;

import dtm.hexdi.prototypes.Lifetime;
import lombok.NonNull;

import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Recortes e transformações sobre um {@link ExportedGraph}.
 */
public final class GraphFilters {

    private GraphFilters() {
    }

    /**
     * Mantém os nós aceitos pelo predicado e apenas as arestas entre dois nós mantidos.
     */
    public static ExportedGraph filter(@NonNull ExportedGraph graph, @NonNull Predicate<ExportedNode> predicate) {
        List<ExportedNode> nodes = graph.nodes().stream().filter(predicate).toList();
        Set<String> ids = nodes.stream().map(ExportedNode::id).collect(Collectors.toSet());
        List<ExportedEdge> edges = graph.edges().stream()
                .filter(edge -> ids.contains(edge.from()) && ids.contains(edge.to()))
                .toList();
        return new ExportedGraph(nodes, edges);
    }

    public static Predicate<ExportedNode> byLifetime(@NonNull Lifetime lifetime) {
        return node -> node.lifetime() == lifetime;
    }

    public static Predicate<ExportedNode> byPortName(@NonNull Pattern pattern) {
        return node -> pattern.matcher(node.id()).find();
    }

    /**
     * Troca os rótulos dos nós; ids e arestas não mudam.
     */
    public static ExportedGraph relabel(@NonNull ExportedGraph graph, @NonNull Function<ExportedNode, String> labeler) {
        List<ExportedNode> nodes = graph.nodes().stream()
                .map(node -> node.withLabel(labeler.apply(node)))
                .toList();
        return new ExportedGraph(nodes, graph.edges());
    }
}
