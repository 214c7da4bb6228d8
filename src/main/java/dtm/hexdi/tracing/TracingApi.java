package dtm.hexdi.tracing;

import java.util.List;

/**
 * Acesso aos traces de um {@link TracingContainer}.
 */
public interface TracingApi {

    List<TraceEntry> getTraces();

    List<TraceEntry> getTraces(TraceFilter filter);

    TraceStats getStats();

    /**
     * Suspende a gravação; traces já coletados são mantidos.
     */
    void pause();

    void resume();

    boolean isPaused();

    /**
     * Esvazia o coletor e reinicia os contadores de id e de ordem.
     */
    void clear();

    /**
     * Registra um ouvinte chamado de forma síncrona após cada trace coletado.
     */
    Subscription subscribe(TraceSubscriber subscriber);

    void pin(String traceId);

    void unpin(String traceId);
}
