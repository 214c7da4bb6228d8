package dtm.hexdi.prototypes;

/**
 * Estado de uma porta do ponto de vista de um resolvedor, sem disparar resolução.
 */
public enum ResolutionStatus {
    RESOLVED,
    UNRESOLVED,
    /** Porta com lifetime scoped consultada no contêiner raiz. */
    SCOPE_REQUIRED
}
