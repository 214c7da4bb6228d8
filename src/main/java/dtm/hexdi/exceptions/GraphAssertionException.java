package dtm.hexdi.exceptions;

import lombok.Getter;

import java.util.List;

@Getter
public class GraphAssertionException extends DependencyContainerException {

    public static final String CODE = "GRAPH_ASSERTION_FAILED";

    private final List<String> portNames;

    public GraphAssertionException(String message, List<String> portNames) {
        super(CODE, message, true);
        this.portNames = List.copyOf(portNames);
    }
}
