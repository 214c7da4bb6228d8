package dtm.hexdi.tracing;

import dtm.hexdi.prototypes.Lifetime;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.List;

/**
 * Registro de uma resolução observada pelo contêiner com tracing.
 * <p>
 * {@code parentTraceId} aponta para a resolução que disparou esta (dependência aninhada);
 * {@code childTraceIds} lista as resoluções disparadas por esta. {@code scopeId} é
 * {@code null} quando a resolução partiu do contêiner raiz.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class TraceEntry {

    @NonNull
    private final String id;

    @NonNull
    private final String portName;

    @NonNull
    private final Lifetime lifetime;

    /** Início da resolução, em milissegundos desde a época. */
    private final long startTime;

    /** Duração em milissegundos. */
    private final double duration;

    private final boolean cacheHit;

    private final String parentTraceId;

    @NonNull
    @Builder.Default
    private final List<String> childTraceIds = List.of();

    private final String scopeId;

    private final long order;

    private final boolean pinned;

    public boolean isRoot() {
        return parentTraceId == null;
    }

    TraceEntry withPinned(boolean pinned) {
        return pinned == this.pinned ? this : toBuilder().pinned(pinned).build();
    }
}
