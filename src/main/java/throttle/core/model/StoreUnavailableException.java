package throttle.core.model;

/**
 * The shared store could not run an atomic operation (connection failure, timeout, script error).
 * This is the only retryable failure; no allow/deny decision was made.
 */
public class StoreUnavailableException extends ThrottleException {

    private final String operation;

    public StoreUnavailableException(String operation, Throwable cause) {
        super("Store unavailable during " + operation + ": " + describe(cause), cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
