package dtm.hexdi.exceptions;

import lombok.Getter;

@Getter
public class DuplicateProviderException extends DependencyContainerException {

    public static final String CODE = "DUPLICATE_PROVIDER";

    private final String portName;

    public DuplicateProviderException(String portName) {
        super(CODE, "Duplicate provider for: " + portName, true);
        this.portName = portName;
    }
}
