package dtm.hexdi.prototypes;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Política de instanciação de um adapter.
 */
public enum Lifetime {
    /** Uma instância por contêiner, compartilhada por todos os escopos. */
    SINGLETON("singleton"),
    /** Uma instância por escopo. */
    SCOPED("scoped"),
    /** Nova instância a cada resolução; nunca armazenada em cache. */
    REQUEST("request");

    private final String value;

    Lifetime(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
