package dtm.hexdi.storage.containers;

import dtm.hexdi.exceptions.CircularDependencyException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
class ResolutionContext {

    private final Set<String> inProgress = new HashSet<>();
    private final List<String> path = new ArrayList<>();

    void enter(String portName) {
        if (inProgress.contains(portName)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(portName), path.size()));
            cycle.add(portName);
            log.error("Dependência circular detectada durante a resolução: {}", String.join(" → ", cycle));
            throw new CircularDependencyException(cycle);
        }
        inProgress.add(portName);
        path.add(portName);
    }

    void exit(String portName) {
        inProgress.remove(portName);
        int last = path.size() - 1;
        if (last >= 0 && path.get(last).equals(portName)) {
            path.remove(last);
        }
    }

    boolean isEmpty() {
        return path.isEmpty();
    }
}
