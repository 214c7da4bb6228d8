package dtm.hexdi.export;

import dtm.hexdi.storage.graph.Graph;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

public final class MermaidExporter {

    public enum Direction { TD, LR }

    private MermaidExporter() {
    }

    public static String toMermaid(Graph graph) {
        return toMermaid(GraphExporter.toExportedGraph(graph), Direction.TD);
    }

    public static String toMermaid(Graph graph, Direction direction) {
        return toMermaid(GraphExporter.toExportedGraph(graph), direction);
    }

    public static String toMermaid(@NonNull ExportedGraph graph, @NonNull Direction direction) {
        List<String> lines = new ArrayList<>();
        lines.add("graph " + direction);

        for (ExportedNode node : graph.nodes()) {
            lines.add("  " + sanitizeId(node.id()) + "[\"" + escapeLabel(node.label())
                    + " (" + node.lifetime().getValue() + ")\"]");
        }

        if (!graph.nodes().isEmpty() && !graph.edges().isEmpty()) {
            lines.add("");
        }
        for (ExportedEdge edge : graph.edges()) {
            lines.add("  " + sanitizeId(edge.from()) + " --> " + sanitizeId(edge.to()));
        }

        return String.join("\n", lines);
    }

    static String sanitizeId(String id) {
        return id.replaceAll("[^a-zA-Z0-9_]", "");
    }

    static String escapeLabel(String label) {
        return label.replace("\"", "#quot;").replace("[", "#91;").replace("]", "#93;");
    }
}
