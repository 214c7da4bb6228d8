package dtm.hexdi.prototypes;

@FunctionalInterface
public interface Factory<T> {
    T create(ResolvedDependencies dependencies) throws Exception;
}
