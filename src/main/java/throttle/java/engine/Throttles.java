package throttle.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import throttle.core.model.KnobUpdate;
import throttle.core.model.StoreUnavailableException;
import throttle.core.model.ThrottleRequest;
import throttle.core.model.ThrottleResult;
import throttle.core.model.ThrottleSnapshot;
import throttle.java.store.ThrottleStore;

import java.math.BigDecimal;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named throttles over a shared {@link ThrottleStore}.
 *
 * Features:
 * - Key format {@code throttle:<name>} so throttles share a namespace with nothing else
 * - Optional persisting of the caller's defaults as the knobs record, once per name and process
 * - Knob administration (set, get, reset, delete)
 * - {@link FailurePolicy} applied when the store is unavailable
 *
 * Thread-safety:
 * - Stateless apart from the set of names whose knobs were initialized
 * - Atomicity of each evaluation is provided by the store
 *
 * Usage example:
 * <pre>
 * Throttles throttles = new Throttles(store, FailurePolicy.PROPAGATE, false);
 * ThrottleResult result = throttles.throttle("reports", ThrottleOptions.of(10).withBurst(2));
 * if (!result.allowed()) {
 *     // Retry after result.secondsUntilCapacity()
 * }
 * </pre>
 */
public final class Throttles {

    private static final Logger LOG = LoggerFactory.getLogger(Throttles.class);

    private final ThrottleStore store;
    private final FailurePolicy failurePolicy;
    private final boolean persistDefaults;
    private final Set<String> initialized = ConcurrentHashMap.newKeySet();

    /**
     * @param store Shared store running the atomic evaluation
     * @param failurePolicy What to return when the store is unavailable
     * @param persistDefaults Whether the first call for a name stores its defaults as knobs, if none exist
     */
    public Throttles(ThrottleStore store, FailurePolicy failurePolicy, boolean persistDefaults) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (failurePolicy == null) {
            throw new IllegalArgumentException("failurePolicy cannot be null");
        }
        this.store = store;
        this.failurePolicy = failurePolicy;
        this.persistDefaults = persistDefaults;
    }

    public ThrottleResult throttle(String name, double rps) {
        return throttle(name, ThrottleOptions.of(rps));
    }

    /**
     * Evaluates one request against the named throttle.
     *
     * @param name Throttle name, without the key prefix
     * @param options Defaults and request size
     * @return ALLOW or REJECT with remaining tokens and seconds until the next window
     * @throws IllegalArgumentException if name is empty
     * @throws throttle.core.model.InvalidConfigurationException if the effective window or burst is not positive
     * @throws StoreUnavailableException if the store failed and the policy is PROPAGATE
     */
    public ThrottleResult throttle(String name, ThrottleOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        String key = key(name);
        ThrottleRequest request = new ThrottleRequest(key, options.knobs(), options.requestedTokens(), options.knobsTtlSeconds());

        try {
            if (persistDefaults && !initialized.contains(key)) {
                if (store.initializeKnobs(key, options.knobs(), options.knobsTtlSeconds())) {
                    LOG.info("Stored default knobs for {}: {}", key, options.knobs());
                }
                initialized.add(key);
            }
            ThrottleResult result = store.evaluate(request);
            LOG.debug("Throttle {} -> {} (tokens={})", key, result.decision(), result.tokens());
            return result;
        } catch (StoreUnavailableException e) {
            return onStoreFailure(key, options, e);
        }
    }

    /**
     * Changes the stored knobs of a throttle.
     *
     * @throws throttle.core.model.UnknownThrottleException if an omitted field is not stored yet
     */
    public void set(String name, KnobUpdate update) {
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        store.setKnobs(key(name), update);
    }

    public ThrottleSnapshot get(String name) {
        return store.snapshot(key(name));
    }

    /**
     * Deletes the stored knobs. The next call uses its own defaults again.
     */
    public void reset(String name) {
        String key = key(name);
        store.resetKnobs(key);
        initialized.remove(key);
        LOG.info("Knobs of {} reset", key);
    }

    /**
     * Deletes the bucket and the knobs.
     */
    public void delete(String name) {
        String key = key(name);
        store.delete(key);
        initialized.remove(key);
        LOG.info("Throttle {} deleted", key);
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    static String key(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        return ThrottleDefaults.THROTTLE_KEY_PREFIX + name;
    }

    private ThrottleResult onStoreFailure(String key, ThrottleOptions options, StoreUnavailableException e) {
        switch (failurePolicy) {
            case FAIL_OPEN:
                LOG.warn("Allowing {} while store is unavailable: {}", key, e.getMessage());
                return ThrottleResult.allow(0, BigDecimal.ZERO);
            case FAIL_CLOSED:
                LOG.warn("Rejecting {} while store is unavailable: {}", key, e.getMessage());
                return ThrottleResult.reject(0, BigDecimal.valueOf(Math.max(1L, options.window())));
            default:
                throw e;
        }
    }
}
