package dtm.hexdi.exceptions;

import lombok.Getter;

@Getter
public class FactoryException extends DependencyContainerException {

    public static final String CODE = "FACTORY_FAILED";

    private final String portName;

    public FactoryException(String portName, Throwable cause) {
        super(CODE, "Factory for port '" + portName + "' threw: " + cause.getMessage(), false, cause);
        this.portName = portName;
    }
}
