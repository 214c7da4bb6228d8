package dtm.hexdi.common;

import lombok.NonNull;

public final class StopWatch {

    private final TimeSource timeSource;
    private final long startTimeMillis;
    private final long startTimeNanos;
    private long stopTimeNanos;
    private boolean running;

    private StopWatch(TimeSource timeSource) {
        this.timeSource = timeSource;
        this.startTimeMillis = timeSource.currentTimeMillis();
        this.startTimeNanos = timeSource.nanoTime();
        this.running = true;
    }

    public static StopWatch start(@NonNull TimeSource timeSource) {
        return new StopWatch(timeSource);
    }

    public StopWatch stop() {
        if (running) {
            this.stopTimeNanos = timeSource.nanoTime();
            this.running = false;
        }
        return this;
    }

    public long getStartTimeMillis() {
        return startTimeMillis;
    }

    public long getElapsedNanos() {
        long end = running ? timeSource.nanoTime() : stopTimeNanos;
        return end - startTimeNanos;
    }

    public double getElapsedMillis() {
        return getElapsedNanos() / 1_000_000.0;
    }

    public boolean isRunning() {
        return running;
    }
}
