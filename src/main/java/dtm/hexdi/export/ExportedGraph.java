package dtm.hexdi.export;

import java.util.List;

public record ExportedGraph(List<ExportedNode> nodes, List<ExportedEdge> edges) {

    public ExportedGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
