package dtm.hexdi.prototypes.inspector;

public enum ScopeStatus {
    ACTIVE("active"),
    DISPOSED("disposed");

    private final String value;

    ScopeStatus(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return value;
    }
}
