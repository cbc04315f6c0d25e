package throttle.core.model;

/**
 * Knob administration referenced a knob field that is not stored for the throttle.
 */
public class UnknownThrottleException extends ThrottleException {

    public UnknownThrottleException(String knobsKey, String field) {
        super("Throttle knob " + knobsKey + " doesn't exist or has no '" + field + "' field");
    }
}
