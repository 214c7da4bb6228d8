package dtm.hexdi.prototypes;

import lombok.NonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Dependências resolvidas entregues a uma {@link Factory}, indexadas pelo nome da porta.
 */
public final class ResolvedDependencies {

    private static final ResolvedDependencies EMPTY = new ResolvedDependencies(Map.of());

    private final Map<String, Object> values;

    private ResolvedDependencies(Map<String, Object> values) {
        this.values = values;
    }

    public static ResolvedDependencies empty() {
        return EMPTY;
    }

    public static ResolvedDependencies of(@NonNull Map<String, ?> values) {
        if (values.isEmpty()) return EMPTY;
        return new ResolvedDependencies(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    @SuppressWarnings("unchecked")
    public <D> D get(@NonNull Port<D> port) {
        return (D) get(port.getName());
    }

    public Object get(@NonNull String portName) {
        if (!values.containsKey(portName)) {
            throw new IllegalArgumentException("Port '" + portName + "' is not a declared dependency");
        }
        return values.get(portName);
    }

    public boolean contains(String portName) {
        return values.containsKey(portName);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "ResolvedDependencies" + values.keySet();
    }
}
