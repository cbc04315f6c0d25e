package throttle.java.store.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import throttle.core.algorithms.running_counter.CounterWindow;
import throttle.core.algorithms.token_bucket.ThrottleEvaluator;
import throttle.core.clock.Clock;
import throttle.core.clock.ClockReading;
import throttle.core.model.Bucket;
import throttle.core.model.CounterBuckets;
import throttle.core.model.InvalidConfigurationException;
import throttle.core.model.KnobUpdate;
import throttle.core.model.Knobs;
import throttle.core.model.ThrottleRequest;
import throttle.core.model.ThrottleResult;
import throttle.core.model.ThrottleSnapshot;
import throttle.core.model.UnknownThrottleException;
import throttle.java.store.ThrottleStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Throttle store for a single process: the atomic units run in Java under a per-key lock.
 *
 * Architecture:
 * - InMemoryKeySpace holds buckets, knobs and counters with TTLs, bounded by an LRU
 * - striped ReentrantLocks: every unit locks the stripe of its throttle name or counter key,
 *   so different names rarely contend and the same name never interleaves
 * - the injected Clock is the store clock, read once per unit while the lock is held
 *
 * Keys are laid out exactly as in the Redis store (bucket at {@code name}, knobs at
 * {@code name:knobs}, counter index at {@code key}, accumulators at {@code key:bucket}).
 */
public final class InMemoryThrottleStore implements ThrottleStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryThrottleStore.class);

    static final String FIELD_TOKENS = "tokens";
    static final String FIELD_REFRESHED = "refreshed";
    private static final int LOCK_STRIPES = 64;

    private final Clock clock;
    private final InMemoryKeySpace keys;
    private final ReentrantLock[] locks;

    /**
     * @param clock Store clock (injected for testability)
     * @param maxKeys Maximum number of stored keys (LRU eviction beyond this)
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public InMemoryThrottleStore(Clock clock, int maxKeys) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        this.keys = new InMemoryKeySpace(maxKeys);
        this.locks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock(); // Non-fair for better throughput
        }
    }

    @Override
    public ThrottleResult evaluate(ThrottleRequest request) {
        ReentrantLock lock = lockFor(request.name());
        lock.lock();
        try {
            ClockReading now = clock.read();
            long nowMicros = toMicros(now);

            Optional<Map<String, String>> storedKnobs = keys.hash(request.knobsKey(), nowMicros)
                .filter(fields -> fields.containsKey(Knobs.FIELD_RPS));
            Knobs effective = storedKnobs.map(fields -> parseKnobs(request.knobsKey(), fields))
                .orElse(request.defaults());
            Optional<Bucket> bucket = keys.hash(request.name(), nowMicros).flatMap(InMemoryThrottleStore::parseBucket);

            // validation happens here, before anything is written
            ThrottleEvaluator.Evaluation evaluation =
                ThrottleEvaluator.evaluate(effective, bucket, now, request.requestedTokens());

            if (storedKnobs.isPresent() && request.knobsTtlSeconds() > 0) {
                keys.expire(request.knobsKey(), request.knobsTtlSeconds(), nowMicros);
            }
            evaluation.updatedBucket().ifPresent(updated -> {
                Map<String, String> fields = new LinkedHashMap<>();
                fields.put(FIELD_TOKENS, Long.toString(updated.tokens()));
                fields.put(FIELD_REFRESHED, Long.toString(updated.refreshed()));
                keys.putHashFields(request.name(), fields, nowMicros);
                keys.expire(request.name(), evaluation.bucketTtlSeconds(), nowMicros);
            });

            LOG.debug("Evaluated {} at {}: {}", request.name(), now.seconds(), evaluation.result());
            return evaluation.result();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void increment(String key, long intervalSeconds, int periods, double amount) {
        requireKey(key);
        CounterWindow window = new CounterWindow(intervalSeconds, periods);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            ClockReading now = clock.read();
            long nowMicros = toMicros(now);
            long bucket = window.bucketAt(now.seconds());
            String bucketKey = CounterBuckets.bucketKey(key, bucket);

            keys.incrementBy(bucketKey, amount, nowMicros);
            NavigableSet<Long> index = keys.index(key, nowMicros, true);
            index.add(bucket);
            window.prune(index, bucket);

            keys.expire(bucketKey, window.expirySeconds(), nowMicros);
            keys.expire(key, window.expirySeconds(), nowMicros);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CounterBuckets buckets(String key, long intervalSeconds, int periods) {
        requireKey(key);
        CounterWindow window = new CounterWindow(intervalSeconds, periods);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            ClockReading now = clock.read();
            long nowMicros = toMicros(now);
            long bucket = window.bucketAt(now.seconds());

            NavigableSet<Long> index = keys.index(key, nowMicros, false);
            if (index == null) {
                return new CounterBuckets(bucket, List.of());
            }
            window.prune(index, bucket);
            if (index.isEmpty()) {
                keys.delete(key);
            }
            return new CounterBuckets(bucket, new ArrayList<>(index));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, Double> counterValues(List<String> bucketKeys) {
        long nowMicros = clock.nowMicros();
        Map<String, Double> values = new HashMap<>();
        for (String bucketKey : bucketKeys) {
            keys.counter(bucketKey, nowMicros).ifPresent(value -> values.put(bucketKey, value));
        }
        return values;
    }

    @Override
    public boolean initializeKnobs(String name, Knobs knobs, long ttlSeconds) {
        String knobsKey = ThrottleRequest.knobsKey(name);
        ReentrantLock lock = lockFor(name);
        lock.lock();
        try {
            long nowMicros = clock.nowMicros();
            if (keys.exists(knobsKey, nowMicros)) {
                return false;
            }
            keys.putHashFields(knobsKey, knobFields(KnobUpdate.of(knobs)), nowMicros);
            if (ttlSeconds > 0) {
                keys.expire(knobsKey, ttlSeconds, nowMicros);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setKnobs(String name, KnobUpdate update) {
        String knobsKey = ThrottleRequest.knobsKey(name);
        ReentrantLock lock = lockFor(name);
        lock.lock();
        try {
            long nowMicros = clock.nowMicros();
            Map<String, String> stored = keys.hash(knobsKey, nowMicros).orElse(Map.of());
            requireStored(knobsKey, stored, Knobs.FIELD_RPS, update.rps());
            requireStored(knobsKey, stored, Knobs.FIELD_BURST, update.burst());
            requireStored(knobsKey, stored, Knobs.FIELD_WINDOW, update.window());

            Map<String, String> fields = knobFields(update);
            if (!fields.isEmpty()) {
                keys.putHashFields(knobsKey, fields, nowMicros);
            }
            if (update.hasTtl()) {
                keys.expire(knobsKey, update.ttlSeconds(), nowMicros);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ThrottleSnapshot snapshot(String name) {
        ReentrantLock lock = lockFor(name);
        lock.lock();
        try {
            long nowMicros = clock.nowMicros();
            Map<String, String> bucket = keys.hash(name, nowMicros).orElse(Map.of());
            Map<String, String> knobs = keys.hash(ThrottleRequest.knobsKey(name), nowMicros).orElse(Map.of());
            return new ThrottleSnapshot(
                parseLong(bucket.get(FIELD_TOKENS)),
                parseLong(bucket.get(FIELD_REFRESHED)),
                parseDouble(knobs.get(Knobs.FIELD_RPS)),
                parseDouble(knobs.get(Knobs.FIELD_BURST)),
                parseLong(knobs.get(Knobs.FIELD_WINDOW))
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void resetKnobs(String name) {
        ReentrantLock lock = lockFor(name);
        lock.lock();
        try {
            keys.delete(ThrottleRequest.knobsKey(name));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String name) {
        ReentrantLock lock = lockFor(name);
        lock.lock();
        try {
            keys.delete(name);
            keys.delete(ThrottleRequest.knobsKey(name));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remaining TTL of a stored key in seconds; -1 without expiry, -2 if absent.
     */
    public long ttlSeconds(String key) {
        return keys.ttlSeconds(key, clock.nowMicros());
    }

    /**
     * Number of stored keys, expired ones included until they are touched.
     */
    public int size() {
        return keys.size();
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public void close() {
        keys.clear();
    }

    private ReentrantLock lockFor(String key) {
        return locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    private static long toMicros(ClockReading reading) {
        return reading.seconds() * ClockReading.MICROS_PER_SECOND + reading.microseconds();
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
    }

    private static void requireStored(String knobsKey, Map<String, String> stored, String field, Object newValue) {
        if (newValue == null && !stored.containsKey(field)) {
            throw new UnknownThrottleException(knobsKey, field);
        }
    }

    private static Map<String, String> knobFields(KnobUpdate update) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (update.rps() != null) fields.put(Knobs.FIELD_RPS, formatNumber(update.rps()));
        if (update.burst() != null) fields.put(Knobs.FIELD_BURST, formatNumber(update.burst()));
        if (update.window() != null) fields.put(Knobs.FIELD_WINDOW, Long.toString(update.window()));
        return fields;
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Called only when {@code rps} is stored; window (and burst, unless rps is a sentinel) must be too.
     */
    static Knobs parseKnobs(String knobsKey, Map<String, String> fields) {
        try {
            double rps = Double.parseDouble(fields.get(Knobs.FIELD_RPS));
            String burst = fields.get(Knobs.FIELD_BURST);
            String window = fields.get(Knobs.FIELD_WINDOW);
            if (window == null || (burst == null && rps != Knobs.RPS_DENY_ALL && rps != Knobs.RPS_ALLOW_ALL)) {
                throw new InvalidConfigurationException("Knobs " + knobsKey + " are incomplete: " + fields);
            }
            double windowSeconds = Double.parseDouble(window);
            if (windowSeconds != Math.rint(windowSeconds) || Double.isInfinite(windowSeconds)) {
                throw new InvalidConfigurationException("Knobs " + knobsKey + " window is not a whole number of seconds: " + window);
            }
            return new Knobs(rps, burst == null ? 0 : Double.parseDouble(burst), (long) windowSeconds);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Knobs " + knobsKey + " are not numeric: " + fields);
        }
    }

    private static Optional<Bucket> parseBucket(Map<String, String> fields) {
        String tokens = fields.get(FIELD_TOKENS);
        if (tokens == null) {
            return Optional.empty();
        }
        return Optional.of(new Bucket(
            (long) Double.parseDouble(tokens),
            (long) Double.parseDouble(fields.getOrDefault(FIELD_REFRESHED, "0"))
        ));
    }

    private static Long parseLong(String value) {
        return value == null ? null : (long) Double.parseDouble(value);
    }

    private static Double parseDouble(String value) {
        return value == null ? null : Double.parseDouble(value);
    }
}
