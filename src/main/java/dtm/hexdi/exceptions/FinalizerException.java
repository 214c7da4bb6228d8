package dtm.hexdi.exceptions;

import java.util.List;

public class FinalizerException extends DependencyContainerException {

    public static final String CODE = "FINALIZER_FAILED";

    private final List<Throwable> errors;

    public FinalizerException(List<? extends Throwable> errors) {
        super(CODE, describe(errors), false);
        this.errors = List.copyOf(errors);
        this.errors.forEach(this::addSuppressed);
    }

    public List<Throwable> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    private static String describe(List<? extends Throwable> errors) {
        StringBuilder message = new StringBuilder()
                .append(errors.size())
                .append(" finalizer(s) failed during disposal");
        for (Throwable error : errors) {
            message.append("; ").append(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        }
        return message.toString();
    }
}
