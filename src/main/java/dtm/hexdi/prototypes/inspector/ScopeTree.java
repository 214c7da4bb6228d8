package dtm.hexdi.prototypes.inspector;

import java.util.List;

/**
 * Nó da hierarquia de escopos.
 *
 * @param id            {@code "container"} na raiz, {@code "scope-N"} nos escopos
 * @param resolvedCount instâncias em cache neste nó
 * @param totalCount    adapters que este nó pode armazenar: todos na raiz, só os scoped nos escopos
 */
public record ScopeTree(
        String id,
        ScopeStatus status,
        int resolvedCount,
        int totalCount,
        List<ScopeTree> children
) {
    public ScopeTree {
        children = List.copyOf(children);
    }

    /**
     * Quantidade de nós desta subárvore, incluindo este.
     */
    public int size() {
        return 1 + children.stream().mapToInt(ScopeTree::size).sum();
    }
}
