package dtm.hexdi.common;

/**
 * Fonte de tempo usada para timestamps de resolução e medição de duração.
 * Substituível em testes.
 */
public interface TimeSource {

    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long currentTimeMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public long nanoTime() {
            return System.nanoTime();
        }
    };

    /** Tempo de parede em milissegundos desde a época. */
    long currentTimeMillis();

    /** Relógio monotônico em nanossegundos, usado apenas para diferenças. */
    long nanoTime();
}
