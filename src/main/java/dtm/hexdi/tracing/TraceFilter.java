package dtm.hexdi.tracing;

import dtm.hexdi.prototypes.Lifetime;
import lombok.Builder;
import lombok.Getter;

import java.util.Locale;
import java.util.Objects;

/**
 * Critérios de consulta de traces. Campos não informados não filtram.
 * Durações mínima e máxima são inclusivas; o nome da porta casa por substring
 * sem diferenciar maiúsculas.
 */
@Getter
@Builder
public class TraceFilter {

    public static final TraceFilter NONE = TraceFilter.builder().build();

    private final String portName;
    private final Lifetime lifetime;
    private final Boolean cacheHit;
    private final Double minDuration;
    private final Double maxDuration;
    private final String scopeId;
    private final boolean scopeIdSet;
    private final Boolean pinned;

    public boolean matches(TraceEntry trace) {
        if (portName != null
                && !trace.getPortName().toLowerCase(Locale.ROOT).contains(portName.toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (lifetime != null && trace.getLifetime() != lifetime) {
            return false;
        }
        if (cacheHit != null && trace.isCacheHit() != cacheHit) {
            return false;
        }
        if (minDuration != null && trace.getDuration() < minDuration) {
            return false;
        }
        if (maxDuration != null && trace.getDuration() > maxDuration) {
            return false;
        }
        if (scopeIdSet && !Objects.equals(trace.getScopeId(), scopeId)) {
            return false;
        }
        return pinned == null || trace.isPinned() == pinned;
    }

    public static class TraceFilterBuilder {

        /**
         * Filtra pelo escopo de origem; {@code null} seleciona as resoluções feitas no contêiner raiz.
         */
        public TraceFilterBuilder scopeId(String scopeId) {
            this.scopeId = scopeId;
            this.scopeIdSet = true;
            return this;
        }

        public TraceFilterBuilder rootScope() {
            return scopeId(null);
        }
    }
}
