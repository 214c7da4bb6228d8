package dtm.hexdi.tracing;

@FunctionalInterface
public interface Subscription {

    Subscription NONE = () -> {};

    void unsubscribe();
}
