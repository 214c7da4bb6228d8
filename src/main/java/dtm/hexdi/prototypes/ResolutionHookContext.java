package dtm.hexdi.prototypes;

/**
 * Contexto entregue a {@code ResolutionHooks#beforeResolve}.
 *
 * @param port        porta em resolução
 * @param lifetime    lifetime do adapter
 * @param scopeId     id do escopo que iniciou a resolução, ou {@code null} no contêiner raiz
 * @param parentPort  porta cuja factory disparou esta resolução, ou {@code null} no topo
 * @param cacheHit    se a instância veio do cache
 * @param depth       profundidade na cadeia de resolução (0 no topo)
 */
public record ResolutionHookContext(
        Port<?> port,
        Lifetime lifetime,
        String scopeId,
        Port<?> parentPort,
        boolean cacheHit,
        int depth
) {
    public String portName() {
        return port.getName();
    }
}
