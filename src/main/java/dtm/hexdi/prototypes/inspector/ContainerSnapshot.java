package dtm.hexdi.prototypes.inspector;

import java.util.List;
import java.util.Optional;

public record ContainerSnapshot(
        boolean disposed,
        List<SingletonEntry> singletons,
        ScopeTree scopes
) {
    public ContainerSnapshot {
        singletons = List.copyOf(singletons);
    }

    public Optional<SingletonEntry> findSingleton(String portName) {
        return singletons.stream().filter(entry -> entry.portName().equals(portName)).findFirst();
    }
}
