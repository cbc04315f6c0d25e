package throttle.core.model;

/**
 * Base class of the throttle error taxonomy.
 */
public class ThrottleException extends RuntimeException {

    public ThrottleException(String message) {
        super(message);
    }

    public ThrottleException(String message, Throwable cause) {
        super(message, cause);
    }
}
