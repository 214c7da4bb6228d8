package dtm.hexdi.prototypes;

public record ResolutionResultContext(
        ResolutionHookContext context,
        double durationMillis,
        Throwable error
) {
    public Port<?> port() {
        return context.port();
    }

    public String portName() {
        return context.portName();
    }

    public Lifetime lifetime() {
        return context.lifetime();
    }

    public String scopeId() {
        return context.scopeId();
    }

    public boolean cacheHit() {
        return context.cacheHit();
    }

    public boolean failed() {
        return error != null;
    }
}
