package dtm.hexdi.core;

/**
 * Resolvedor filho, com cache próprio para portas scoped.
 */
public interface Scope extends Resolver {

    /**
     * Resolvedor que criou este escopo.
     */
    Resolver getParent();
}
