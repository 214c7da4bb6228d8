package dtm.hexdi.prototypes.inspector;

import dtm.hexdi.prototypes.Lifetime;

public record SingletonEntry(
        String portName,
        Lifetime lifetime,
        boolean resolved,
        Long resolvedAt,
        Long resolutionOrder
) {
}
