package dtm.hexdi.tracing;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Regras de retenção do {@link MemoryCollector}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class TraceRetentionPolicy {

    public static final TraceRetentionPolicy DEFAULT = TraceRetentionPolicy.builder().build();

    /** Limite de traces retidos; os não fixados mais antigos saem primeiro. */
    @Builder.Default
    private final int maxTraces = 1000;

    /** Limite de traces fixados; acima dele os fixados mais antigos são descartados. */
    @Builder.Default
    private final int maxPinnedTraces = 100;

    /** Traces com duração igual ou acima deste valor são fixados automaticamente. */
    @Builder.Default
    private final double slowThresholdMs = 100;

    /** Idade máxima de um trace não fixado. */
    @Builder.Default
    private final long expiryMs = 300_000;
}
