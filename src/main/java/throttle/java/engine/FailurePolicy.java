package throttle.java.engine;

/**
 * What a throttle call returns when the shared store cannot be reached.
 */
public enum FailurePolicy {
    /**
     * Rethrow {@link throttle.core.model.StoreUnavailableException} to the caller.
     */
    PROPAGATE,

    /**
     * Allow the request. Protects availability at the cost of exceeding the rate while the store is down.
     */
    FAIL_OPEN,

    /**
     * Deny the request and ask the caller to wait one window.
     */
    FAIL_CLOSED
}
