package dtm.hexdi.exceptions;

import lombok.Getter;

@Getter
public class UnknownPortException extends DependencyContainerException {

    public static final String CODE = "UNKNOWN_PORT";

    private final String portName;

    public UnknownPortException(String portName) {
        super(CODE, "No adapter registered for port '" + portName + "'", true);
        this.portName = portName;
    }
}
