package throttle.core.model;

/**
 * The effective knobs of a throttle cannot drive a token bucket (non-positive window or burst).
 * Not retryable: the knobs or the caller's defaults must be fixed.
 */
public class InvalidConfigurationException extends ThrottleException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
