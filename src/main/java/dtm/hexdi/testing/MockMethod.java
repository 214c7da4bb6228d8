package dtm.hexdi.testing;

@FunctionalInterface
public interface MockMethod {
    Object invoke(Object[] args) throws Throwable;
}
