package dtm.hexdi.storage.graph;

import dtm.hexdi.exceptions.CircularDependencyException;
import dtm.hexdi.prototypes.Adapter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
class GraphLayerResolver {

    private final Map<String, Set<String>> dependencyGraph;

    GraphLayerResolver(Graph graph) {
        this.dependencyGraph = new LinkedHashMap<>();
        for (Adapter<?> adapter : graph.getAdapters()) {
            dependencyGraph.put(adapter.getPortName(), new LinkedHashSet<>(adapter.getRequiredPortNames()));
        }
    }

    List<Set<String>> resolveLayers() {
        List<Set<String>> layers = new ArrayList<>();
        Set<String> processed = new HashSet<>();

        if (dependencyGraph.isEmpty()) {
            return layers;
        }

        Set<String> currentLayer = nextLayer(processed);

        while (!currentLayer.isEmpty()) {
            layers.add(Set.copyOf(currentLayer));
            processed.addAll(currentLayer);
            if (log.isDebugEnabled()) {
                log.debug("Camada {}: {}", layers.size() - 1, currentLayer);
            }
            currentLayer = nextLayer(processed);
        }

        if (processed.size() < dependencyGraph.size()) {
            handleCircularDependency(processed);
        }

        return layers;
    }

    private Set<String> nextLayer(Set<String> processed) {
        return dependencyGraph.entrySet().stream()
                .filter(entry -> !processed.contains(entry.getKey()))
                .filter(entry -> processed.containsAll(entry.getValue()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private void handleCircularDependency(Set<String> processed) {
        for (String start : dependencyGraph.keySet()) {
            if (processed.contains(start)) continue;
            List<String> cycle = findCycle(start);
            if (cycle != null) {
                logCycle(cycle);
                List<String> chain = new ArrayList<>(cycle);
                chain.add(cycle.get(0));
                throw new CircularDependencyException(chain);
            }
        }
        throw new IllegalStateException("Unresolvable ports without a detectable cycle: " + dependencyGraph.keySet());
    }

    private List<String> findCycle(String start) {
        return findCycleRecursive(start, start, new ArrayList<>(), new HashSet<>());
    }

    private List<String> findCycleRecursive(String current, String target, List<String> path, Set<String> visited) {
        if (visited.contains(current)) {
            return null;
        }

        path.add(current);
        visited.add(current);

        for (String dep : dependencyGraph.getOrDefault(current, Set.of())) {
            if (dep.equals(target)) {
                return new ArrayList<>(path);
            }

            List<String> result = findCycleRecursive(dep, target, new ArrayList<>(path), new HashSet<>(visited));
            if (result != null) {
                return result;
            }
        }

        return null;
    }

    private void logCycle(List<String> cycle) {
        StringBuilder cycleLog = new StringBuilder();
        cycleLog.append("\n╔════════════════════════════════════════════════════════════════╗\n");
        cycleLog.append("║              DEPENDÊNCIA CIRCULAR NO GRAFO                     ║\n");
        cycleLog.append("╚════════════════════════════════════════════════════════════════╝\n\n");
        cycleLog.append("  Caminho: ")
                .append(String.join(" → ", cycle))
                .append(" → ")
                .append(cycle.get(0))
                .append(" ⟲\n");

        log.error(cycleLog.toString());
    }
}
