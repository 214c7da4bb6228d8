package dtm.hexdi.tracing;

public record TraceStats(
        int totalResolutions,
        double averageDuration,
        double cacheHitRate,
        int slowCount,
        long sessionStart,
        double totalDuration
) {
    public static final TraceStats EMPTY = empty(0);

    public static TraceStats empty(long sessionStart) {
        return new TraceStats(0, 0, 0, 0, sessionStart, 0);
    }
}
