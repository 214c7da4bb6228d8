package dtm.hexdi.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dtm.hexdi.prototypes.Adapter;
import dtm.hexdi.prototypes.Port;
import dtm.hexdi.storage.graph.Graph;
import lombok.NonNull;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Converte um {@link Graph} em {@link ExportedGraph}, com nós ordenados por id e
 * arestas por origem e destino, e o serializa em JSON.
 */
public final class GraphExporter {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper PRETTY_JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private static final Comparator<ExportedEdge> EDGE_ORDER = Comparator
            .comparing(ExportedEdge::from)
            .thenComparing(ExportedEdge::to);

    private GraphExporter() {
    }

    public static ExportedGraph toExportedGraph(@NonNull Graph graph) {
        List<ExportedNode> nodes = new ArrayList<>();
        List<ExportedEdge> edges = new ArrayList<>();

        for (Adapter<?> adapter : graph.getAdapters()) {
            String portName = adapter.getPortName();
            nodes.add(new ExportedNode(portName, portName, adapter.getLifetime()));
            for (Port<?> required : adapter.getRequires()) {
                edges.add(new ExportedEdge(portName, required.getName()));
            }
        }

        nodes.sort(Comparator.comparing(ExportedNode::id));
        edges.sort(EDGE_ORDER);
        return new ExportedGraph(nodes, edges);
    }

    public static String toJson(Graph graph) {
        return toJson(toExportedGraph(graph), false);
    }

    public static String toJson(@NonNull ExportedGraph graph, boolean pretty) {
        return writeJson(graph, pretty);
    }

    public static String writeJson(Object value, boolean pretty) {
        try {
            return (pretty ? PRETTY_JSON : JSON).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Falha ao serializar " + value.getClass().getSimpleName(), e);
        }
    }
}
