package dtm.hexdi.core;

import dtm.hexdi.prototypes.ResolutionHookContext;
import dtm.hexdi.prototypes.ResolutionResultContext;
import lombok.NonNull;

/**
 * Observadores chamados em torno de cada resolução, inclusive acertos de cache
 * e dependências resolvidas recursivamente.
 */
public interface ResolutionHooks {

    ResolutionHooks NONE = new ResolutionHooks() {};

    default void beforeResolve(ResolutionHookContext context) {
    }

    /**
     * Chamado sempre, mesmo quando a resolução falha.
     */
    default void afterResolve(ResolutionResultContext context) {
    }

    /**
     * Combina dois observadores; {@code first} é chamado antes de {@code second} nos dois eventos.
     * Os dois são sempre chamados, mesmo que o outro falhe, e a primeira falha é relançada
     * com as seguintes suprimidas.
     */
    static ResolutionHooks chain(@NonNull ResolutionHooks first, @NonNull ResolutionHooks second) {
        if (first == NONE) return second;
        if (second == NONE) return first;

        return new ResolutionHooks() {
            @Override
            public void beforeResolve(ResolutionHookContext context) {
                RuntimeException failure = invoke(null, () -> first.beforeResolve(context));
                failure = invoke(failure, () -> second.beforeResolve(context));
                if (failure != null) throw failure;
            }

            @Override
            public void afterResolve(ResolutionResultContext context) {
                RuntimeException failure = invoke(null, () -> first.afterResolve(context));
                failure = invoke(failure, () -> second.afterResolve(context));
                if (failure != null) throw failure;
            }
        };
    }

    private static RuntimeException invoke(RuntimeException previous, Runnable hook) {
        try {
            hook.run();
            return previous;
        } catch (RuntimeException e) {
            if (previous == null) return e;
            previous.addSuppressed(e);
            return previous;
        }
    }
}
