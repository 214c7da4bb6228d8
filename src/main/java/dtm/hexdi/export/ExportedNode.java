package dtm.hexdi.export;

import dtm.hexdi.prototypes.Lifetime;

public record ExportedNode(String id, String label, Lifetime lifetime) {

    public ExportedNode withLabel(String label) {
        return new ExportedNode(id, label, lifetime);
    }
}
