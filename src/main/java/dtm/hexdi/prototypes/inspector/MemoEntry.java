package dtm.hexdi.prototypes.inspector;

import dtm.hexdi.prototypes.Lifetime;

public record MemoEntry(
        String portName,
        Lifetime lifetime,
        long resolvedAt,
        long resolutionOrder
) {
}
