package dtm.hexdi.export;

import dtm.hexdi.prototypes.Lifetime;
import dtm.hexdi.storage.graph.Graph;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renderiza o grafo no formato DOT do Graphviz.
 */
public final class DotExporter {

    private static final Map<Lifetime, String> LIFETIME_COLORS = new EnumMap<>(Lifetime.class);

    static {
        LIFETIME_COLORS.put(Lifetime.SINGLETON, "#E8F5E9");
        LIFETIME_COLORS.put(Lifetime.SCOPED, "#E3F2FD");
        LIFETIME_COLORS.put(Lifetime.REQUEST, "#FFF3E0");
    }

    private DotExporter() {
    }

    public static String toDot(Graph graph) {
        return toDot(GraphExporter.toExportedGraph(graph), DotOptions.DEFAULT);
    }

    public static String toDot(Graph graph, DotOptions options) {
        return toDot(GraphExporter.toExportedGraph(graph), options);
    }

    public static String toDot(@NonNull ExportedGraph graph, @NonNull DotOptions options) {
        boolean styled = options.getPreset() == DotOptions.Preset.STYLED;

        List<String> lines = new ArrayList<>();
        lines.add("digraph DependencyGraph {");
        lines.add("  rankdir=" + options.getDirection() + ";");
        lines.add("  node [shape=box];");

        if (!graph.nodes().isEmpty()) {
            lines.add("");
        }
        for (ExportedNode node : graph.nodes()) {
            lines.add(renderNode(node, styled));
        }

        if (!graph.edges().isEmpty()) {
            lines.add("");
        }
        for (ExportedEdge edge : graph.edges()) {
            lines.add("  \"" + escape(edge.from()) + "\" -> \"" + escape(edge.to()) + "\";");
        }

        lines.add("}");
        return String.join("\n", lines);
    }

    private static String renderNode(ExportedNode node, boolean styled) {
        String label = escape(node.label()) + "\\n(" + node.lifetime().getValue() + ")";
        StringBuilder line = new StringBuilder()
                .append("  \"").append(escape(node.id())).append("\" [label=\"").append(label).append('"');
        if (styled) {
            line.append(", style=filled, fillcolor=\"")
                    .append(LIFETIME_COLORS.getOrDefault(node.lifetime(), "#FFFFFF"))
                    .append('"');
        }
        return line.append("];").toString();
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
