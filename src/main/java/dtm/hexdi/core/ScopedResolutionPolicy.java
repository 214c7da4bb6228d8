package dtm.hexdi.core;

/**
 * Comportamento do contêiner raiz ao receber uma porta scoped.
 */
public enum ScopedResolutionPolicy {
    /** Lança {@link dtm.hexdi.exceptions.ScopeRequiredException}. */
    REJECT,
    /**
     * A raiz atua como escopo implícito, com cache scoped próprio finalizado
     * no descarte do contêiner. A inspeção continua reportando {@code SCOPE_REQUIRED}.
     */
    ROOT_AS_SCOPE
}
