package dtm.hexdi.prototypes;

import lombok.NonNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Rotina de limpeza executada sobre uma instância durante o descarte do seu resolvedor.
 *
 * A finalização pode ser assíncrona: o descarte só termina quando o
 * {@link CompletionStage} retornado for concluído.
 *
 * @param <T> tipo da instância finalizada
 */
@FunctionalInterface
public interface Finalizer<T> {

    CompletionStage<Void> release(T instance) throws Exception;

    /**
     * Adapta uma rotina síncrona.
     */
    static <T> Finalizer<T> of(@NonNull SyncFinalizer<T> action) {
        return instance -> {
            action.release(instance);
            return CompletableFuture.completedFuture(null);
        };
    }

    @FunctionalInterface
    interface SyncFinalizer<T> {
        void release(T instance) throws Exception;
    }
}
