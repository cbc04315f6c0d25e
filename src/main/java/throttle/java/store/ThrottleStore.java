package throttle.java.store;

import throttle.core.model.CounterBuckets;
import throttle.core.model.KnobUpdate;
import throttle.core.model.Knobs;
import throttle.core.model.ThrottleRequest;
import throttle.core.model.ThrottleResult;
import throttle.core.model.ThrottleSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Shared store that runs the throttle and running counter algorithms as atomic units.
 *
 * <p>{@link #evaluate}, {@link #increment} and {@link #buckets} each execute as one indivisible
 * operation and read "now" from the store's own clock, never from the caller. Distinct throttle
 * names and counter keys do not contend.
 *
 * <p>Every method throws {@link throttle.core.model.StoreUnavailableException} when the store cannot
 * run the operation; in that case nothing was written.
 */
public interface ThrottleStore extends AutoCloseable {

    /**
     * Evaluates one request against the throttle bucket stored at {@code request.name()}.
     *
     * @throws throttle.core.model.InvalidConfigurationException if the effective window or burst is not positive
     */
    ThrottleResult evaluate(ThrottleRequest request);

    /**
     * Adds {@code amount} to the current bucket of a running counter and prunes expired bucket indices.
     */
    void increment(String key, long intervalSeconds, int periods, double amount);

    /**
     * Prunes expired bucket indices of a running counter and returns the live ones.
     */
    CounterBuckets buckets(String key, long intervalSeconds, int periods);

    /**
     * Reads accumulator values. Keys that do not exist are absent from the result.
     */
    Map<String, Double> counterValues(List<String> bucketKeys);

    /**
     * Stores {@code knobs} under {@code <name>:knobs} unless a knobs record already exists.
     *
     * @return true if the knobs were written
     */
    boolean initializeKnobs(String name, Knobs knobs, long ttlSeconds);

    /**
     * Applies an operator change to the stored knobs.
     *
     * @throws throttle.core.model.UnknownThrottleException if a field left out of the update is not stored
     */
    void setKnobs(String name, KnobUpdate update);

    ThrottleSnapshot snapshot(String name);

    /**
     * Deletes the knobs so the callers' defaults apply again.
     */
    void resetKnobs(String name);

    /**
     * Deletes bucket and knobs.
     */
    void delete(String name);

    /**
     * Round trip to the store, used by health checks.
     *
     * @return false if the store cannot be reached
     */
    boolean ping();

    @Override
    void close();
}
