package dtm.hexdi.core;

import dtm.hexdi.exceptions.CircularDependencyException;
import dtm.hexdi.exceptions.DisposedResolverException;
import dtm.hexdi.exceptions.FactoryException;
import dtm.hexdi.exceptions.ScopeRequiredException;
import dtm.hexdi.prototypes.Port;
import dtm.hexdi.prototypes.ResolutionStatus;

import java.util.concurrent.CompletableFuture;

/**
 * Contexto de resolução: o contêiner raiz ou um escopo filho.
 *
 * Ciclo de vida: ativo até {@link #dispose()}, descartado depois disso. O descarte é
 * terminal e todas as operações, exceto o próprio {@code dispose}, passam a falhar.
 */
public interface Resolver {

    /**
     * Identificador do resolvedor: {@code "container"} para a raiz, {@code "scope-N"} para escopos.
     */
    String getId();

    /**
     * Obtém a instância associada à porta, respeitando o lifetime do seu adapter.
     *
     * @throws DisposedResolverException   se o resolvedor já foi descartado
     * @throws CircularDependencyException se a cadeia de resolução voltar a uma porta em andamento
     * @throws ScopeRequiredException      se uma porta scoped for resolvida a partir da raiz
     * @throws FactoryException            se a factory de algum adapter falhar
     */
    <T> T resolve(Port<T> port);

    /**
     * Cria um escopo filho com cache scoped próprio e vazio.
     */
    Scope createScope();

    /**
     * Descarta os escopos filhos e depois finaliza as instâncias deste resolvedor em ordem
     * inversa de criação. Chamadas repetidas devolvem o mesmo futuro.
     *
     * @return futuro concluído quando todos os finalizers terminarem; conclui com
     * {@link dtm.hexdi.exceptions.FinalizerException} se algum falhar
     */
    CompletableFuture<Void> dispose();

    boolean isDisposed();

    /**
     * Consulta o estado de uma porta sem resolvê-la.
     */
    ResolutionStatus isResolved(Port<?> port);

    /**
     * Indica se resolver a porta a partir deste resolvedor exige um escopo ativo.
     */
    boolean requiresScope(Port<?> port);
}
