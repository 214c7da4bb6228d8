package dtm.hexdi.exceptions;

import lombok.Getter;

@Getter
public class DependencyContainerException extends RuntimeException {

    private final String code;
    private final boolean programmingError;

    public DependencyContainerException(String code, String message, boolean programmingError) {
        super(message);
        this.code = code;
        this.programmingError = programmingError;
    }

    public DependencyContainerException(String code, String message, boolean programmingError, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.programmingError = programmingError;
    }

}
