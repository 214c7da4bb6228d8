package dtm.hexdi.exceptions;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lançada por {@code GraphBuilder.build} quando uma ou mais portas requeridas
 * não possuem provedor. Todas as portas ausentes são reportadas de uma vez,
 * uma mensagem por porta.
 */
@Getter
public class MissingDependencyException extends DependencyContainerException {

    public static final String CODE = "MISSING_DEPENDENCY";
    private static final String PREFIX = "Missing dependencies: ";

    private final Set<String> missingPorts;
    private final List<String> messages;

    public MissingDependencyException(Set<String> missingPorts) {
        super(CODE, describe(missingPorts), true);
        this.missingPorts = Collections.unmodifiableSet(new LinkedHashSet<>(missingPorts));
        this.messages = toMessages(missingPorts);
    }

    private static List<String> toMessages(Set<String> missingPorts) {
        return missingPorts.stream()
                .map(port -> PREFIX + port)
                .toList();
    }

    private static String describe(Set<String> missingPorts) {
        return missingPorts.stream()
                .map(port -> PREFIX + port)
                .collect(Collectors.joining("\n"));
    }
}
