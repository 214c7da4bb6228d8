package dtm.hexdi.tracing;

import dtm.hexdi.core.ContainerOptions;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Configuração de um contêiner com tracing. Sem {@code collector}, um
 * {@link MemoryCollector} é criado com a política de retenção informada.
 */
@Getter
@Builder(toBuilder = true)
public class TracingOptions {

    public static final TracingOptions DEFAULT = TracingOptions.builder().build();

    private final TraceCollector collector;

    @NonNull
    @Builder.Default
    private final TraceRetentionPolicy retentionPolicy = TraceRetentionPolicy.DEFAULT;

    /** Opções do contêiner subjacente; hooks informados aqui são chamados junto com os de tracing. */
    @NonNull
    @Builder.Default
    private final ContainerOptions containerOptions = ContainerOptions.DEFAULT;

    TraceCollector createCollector() {
        return collector != null
                ? collector
                : new MemoryCollector(retentionPolicy, containerOptions.getTimeSource());
    }
}
