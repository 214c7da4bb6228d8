package dtm.hexdi.storage.containers;

import dtm.hexdi.core.Resolver;
import dtm.hexdi.core.Scope;
import dtm.hexdi.storage.memo.MemoMap;

final class ScopeStorage extends AbstractResolverStorage implements Scope {

    private final ContainerStorage container;

    ScopeStorage(ContainerStorage container, AbstractResolverStorage parent, String id) {
        super(id, parent, new MemoMap(container.getResolutionCounter(), container.getTimeSource()));
        this.container = container;
    }

    @Override
    ContainerStorage root() {
        return container;
    }

    @Override
    boolean isRoot() {
        return false;
    }

    @Override
    public Resolver getParent() {
        return getParentStorage();
    }

    @Override
    public String toString() {
        return "Scope[" + getId() + "]";
    }
}
