package dtm.hexdi.core;

import dtm.hexdi.storage.containers.ContainerStorage;
import dtm.hexdi.storage.graph.Graph;

public final class Containers {

    private Containers() {
    }

    public static Container create(Graph graph) {
        return ContainerStorage.create(graph);
    }

    public static Container create(Graph graph, ContainerOptions options) {
        return ContainerStorage.create(graph, options);
    }
}
