package dtm.hexdi.storage.containers;

enum ResolverState {
    ACTIVE,
    DISPOSING,
    DISPOSED
}
