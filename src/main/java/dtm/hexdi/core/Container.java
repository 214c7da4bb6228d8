package dtm.hexdi.core;

import dtm.hexdi.storage.graph.Graph;

/**
 * Contêiner raiz associado a um {@link Graph}. É dono do cache de singletons,
 * compartilhado por todos os escopos criados a partir dele.
 */
public interface Container extends Resolver {

    Graph getGraph();

    ContainerInspector inspector();
}
