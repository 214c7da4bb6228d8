package dtm.hexdi.exceptions;

import lombok.Getter;

import java.util.List;

/**
 * Dependência circular encontrada durante a resolução.
 *
 * A cadeia começa na porta que fecha o ciclo e termina nela mesma,
 * por exemplo {@code [A, B, A]}.
 */
@Getter
public class CircularDependencyException extends DependencyContainerException {

    public static final String CODE = "CIRCULAR_DEPENDENCY";

    private final List<String> dependencyChain;

    public CircularDependencyException(List<String> dependencyChain) {
        super(CODE, "Circular dependency detected: " + String.join(" -> ", dependencyChain), true);
        this.dependencyChain = List.copyOf(dependencyChain);
    }
}
