package dtm.hexdi.common;

/**
 * Relógio controlado pelo teste. O tempo só anda quando {@link #advance(long)} é chamado.
 */
public class ManualTimeSource implements TimeSource {

    private long millis;

    public ManualTimeSource(long startMillis) {
        this.millis = startMillis;
    }

    public void advance(long deltaMillis) {
        millis += deltaMillis;
    }

    @Override
    public long currentTimeMillis() {
        return millis;
    }

    @Override
    public long nanoTime() {
        return millis * 1_000_000L;
    }
}
