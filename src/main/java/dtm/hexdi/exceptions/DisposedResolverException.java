package dtm.hexdi.exceptions;

import lombok.Getter;

@Getter
public class DisposedResolverException extends DependencyContainerException {

    public static final String CODE = "DISPOSED_SCOPE";

    private final String portName;

    public DisposedResolverException(String portName) {
        super(CODE, "Cannot resolve port '" + portName + "' from a disposed scope. "
                + "The scope has already been disposed and cannot be used for resolution.", true);
        this.portName = portName;
    }

    public DisposedResolverException(String resolverId, String operation) {
        super(CODE, "Cannot " + operation + " on '" + resolverId + "': it has already been disposed.", true);
        this.portName = null;
    }
}
