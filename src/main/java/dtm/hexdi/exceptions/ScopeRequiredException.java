package dtm.hexdi.exceptions;

import lombok.Getter;

@Getter
public class ScopeRequiredException extends DependencyContainerException {

    public static final String CODE = "SCOPE_REQUIRED";

    private final String portName;

    public ScopeRequiredException(String portName) {
        super(CODE, "Cannot resolve scoped port '" + portName + "' from the root container. "
                + "Scoped ports must be resolved from a scope created via createScope().", true);
        this.portName = portName;
    }
}
