package dtm.hexdi.core;

import dtm.hexdi.prototypes.ResolutionStatus;
import dtm.hexdi.prototypes.inspector.ContainerSnapshot;
import dtm.hexdi.prototypes.inspector.ScopeTree;

import java.util.List;

/**
 * Visão somente leitura do estado de um contêiner, consumida por ferramentas de inspeção.
 * Todas as operações falham com {@link dtm.hexdi.exceptions.DisposedResolverException}
 * depois que o contêiner é descartado.
 */
public interface ContainerInspector {

    ContainerSnapshot snapshot();

    ScopeTree getScopeTree();

    ResolutionStatus isResolved(String portName);

    /**
     * Nomes de todas as portas do grafo, em ordem alfabética.
     */
    List<String> listPorts();
}
