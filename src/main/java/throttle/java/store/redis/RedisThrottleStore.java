package throttle.java.store.redis;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Command;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.Request;
import io.vertx.mutiny.redis.client.Response;
import io.vertx.redis.client.RedisOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import throttle.core.model.CounterBuckets;
import throttle.core.model.InvalidConfigurationException;
import throttle.core.model.KnobUpdate;
import throttle.core.model.Knobs;
import throttle.core.model.StoreUnavailableException;
import throttle.core.model.ThrottleRequest;
import throttle.core.model.ThrottleResult;
import throttle.core.model.ThrottleSnapshot;
import throttle.core.model.UnknownThrottleException;
import throttle.java.store.ThrottleStore;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis-backed throttle store for distributed deployments.
 *
 * <p>The throttle and running counter algorithms run as Lua scripts, so every evaluation is atomic
 * on the Redis server and reads Redis TIME, never the caller's clock.
 *
 * <p>Features:
 * <ul>
 *   <li>EVALSHA with a fallback to EVAL when the server has not cached a script yet</li>
 *   <li>Bounded blocking wait per command; a timeout or connection failure becomes
 *       {@link StoreUnavailableException}</li>
 *   <li>Script errors tagged INVALID_CONFIGURATION become {@link InvalidConfigurationException}</li>
 * </ul>
 *
 * <p>Key layout: bucket hash at {@code name}, knobs hash at {@code name:knobs}, counter index
 * (sorted set) at {@code key}, accumulators at {@code key:bucket}.
 */
public final class RedisThrottleStore implements ThrottleStore {

    private static final Logger LOG = LoggerFactory.getLogger(RedisThrottleStore.class);

    private static final String INVALID_CONFIGURATION = "INVALID_CONFIGURATION";
    private static final String NO_SCRIPT = "NOSCRIPT";

    private final Vertx vertx;
    private final Redis redis;
    private final Duration timeout;
    private final LuaScript throttleScript;
    private final LuaScript counterScript;
    private final LuaScript counterGetScript;
    private final LuaScript knobsInitScript;

    /**
     * Creates a store over an existing client. The caller keeps ownership of the client and its Vert.x instance.
     *
     * @param redis Redis client
     * @param timeout Maximum wait for one Redis round trip
     * @param frozenTime Whether scripts honour the frozen_second/frozen_microsecond test keys
     */
    public RedisThrottleStore(Redis redis, Duration timeout, boolean frozenTime) {
        this(null, redis, timeout, frozenTime);
    }

    private RedisThrottleStore(Vertx vertx, Redis redis, Duration timeout, boolean frozenTime) {
        if (redis == null) {
            throw new IllegalArgumentException("redis cannot be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.vertx = vertx;
        this.redis = redis;
        this.timeout = timeout;
        this.throttleScript = LuaScript.load("throttle.lua", frozenTime);
        this.counterScript = LuaScript.load("running_counter.lua", frozenTime);
        this.counterGetScript = LuaScript.load("running_counter_get.lua", frozenTime);
        this.knobsInitScript = LuaScript.load("knobs_init.lua", false);
    }

    /**
     * Connects to Redis with a private Vert.x instance, closed together with the store.
     *
     * @param connectionString e.g. {@code redis://localhost:6379}
     */
    public static RedisThrottleStore connect(String connectionString, Duration timeout) {
        Vertx vertx = Vertx.vertx();
        Redis redis = Redis.createClient(vertx, new RedisOptions().setConnectionString(connectionString));
        LOG.info("Redis throttle store using {}", connectionString);
        return new RedisThrottleStore(vertx, redis, timeout, false);
    }

    @Override
    public ThrottleResult evaluate(ThrottleRequest request) {
        Knobs defaults = request.defaults();
        Response response = runScript("evaluate", throttleScript,
            List.of(request.name(), request.knobsKey()),
            List.of(
                formatNumber(defaults.rps()),
                formatNumber(defaults.burst()),
                Long.toString(defaults.window()),
                Long.toString(request.requestedTokens()),
                Long.toString(request.knobsTtlSeconds())
            ));

        boolean allowed = response.get(0).toLong() == 1L;
        long tokens = response.get(1).toLong();
        BigDecimal seconds = new BigDecimal(response.get(2).toString());
        ThrottleResult result = allowed ? ThrottleResult.allow(tokens, seconds) : ThrottleResult.reject(tokens, seconds);
        LOG.debug("Evaluated {}: {}", request.name(), result);
        return result;
    }

    @Override
    public void increment(String key, long intervalSeconds, int periods, double amount) {
        requireCounterArgs(key, intervalSeconds, periods);
        runScript("increment", counterScript,
            List.of(key),
            List.of(Long.toString(intervalSeconds), Integer.toString(periods), Double.toString(amount)));
    }

    @Override
    public CounterBuckets buckets(String key, long intervalSeconds, int periods) {
        requireCounterArgs(key, intervalSeconds, periods);
        Response response = runScript("buckets", counterGetScript,
            List.of(key),
            List.of(Long.toString(intervalSeconds), Integer.toString(periods)));

        long current = response.get(0).toLong();
        Response members = response.get(1);
        List<Long> live = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            live.add((long) Double.parseDouble(members.get(i).toString()));
        }
        live.sort(Long::compareTo);
        return new CounterBuckets(current, live);
    }

    @Override
    public Map<String, Double> counterValues(List<String> bucketKeys) {
        Map<String, Double> values = new HashMap<>();
        if (bucketKeys.isEmpty()) {
            return values;
        }
        Request mget = Request.cmd(Command.MGET);
        bucketKeys.forEach(mget::arg);
        Response response = send("counterValues", mget);
        for (int i = 0; i < bucketKeys.size(); i++) {
            Response value = response.get(i);
            if (value != null) {
                values.put(bucketKeys.get(i), Double.parseDouble(value.toString()));
            }
        }
        return values;
    }

    @Override
    public boolean initializeKnobs(String name, Knobs knobs, long ttlSeconds) {
        Response response = runScript("initializeKnobs", knobsInitScript,
            List.of(ThrottleRequest.knobsKey(name)),
            List.of(
                formatNumber(knobs.rps()),
                formatNumber(knobs.burst()),
                Long.toString(knobs.window()),
                Long.toString(Math.max(0L, ttlSeconds))
            ));
        return response.toLong() == 1L;
    }

    @Override
    public void setKnobs(String name, KnobUpdate update) {
        String knobsKey = ThrottleRequest.knobsKey(name);
        requireStored(knobsKey, Knobs.FIELD_RPS, update.rps());
        requireStored(knobsKey, Knobs.FIELD_BURST, update.burst());
        requireStored(knobsKey, Knobs.FIELD_WINDOW, update.window());

        Request hset = Request.cmd(Command.HSET).arg(knobsKey);
        int fields = 0;
        if (update.rps() != null) {
            hset.arg(Knobs.FIELD_RPS).arg(formatNumber(update.rps()));
            fields++;
        }
        if (update.burst() != null) {
            hset.arg(Knobs.FIELD_BURST).arg(formatNumber(update.burst()));
            fields++;
        }
        if (update.window() != null) {
            hset.arg(Knobs.FIELD_WINDOW).arg(Long.toString(update.window()));
            fields++;
        }
        if (fields > 0) {
            send("setKnobs", hset);
        }
        if (update.hasTtl()) {
            send("setKnobs", Request.cmd(Command.EXPIRE).arg(knobsKey).arg(Long.toString(update.ttlSeconds())));
        }
        LOG.info("Knobs of {} updated: {}", name, update);
    }

    @Override
    public ThrottleSnapshot snapshot(String name) {
        Response bucket = send("snapshot",
            Request.cmd(Command.HMGET).arg(name).arg("tokens").arg("refreshed"));
        Response knobs = send("snapshot",
            Request.cmd(Command.HMGET).arg(ThrottleRequest.knobsKey(name))
                .arg(Knobs.FIELD_RPS).arg(Knobs.FIELD_BURST).arg(Knobs.FIELD_WINDOW));
        return new ThrottleSnapshot(
            toLong(bucket.get(0)),
            toLong(bucket.get(1)),
            toDouble(knobs.get(0)),
            toDouble(knobs.get(1)),
            toLong(knobs.get(2))
        );
    }

    @Override
    public void resetKnobs(String name) {
        send("resetKnobs", Request.cmd(Command.DEL).arg(ThrottleRequest.knobsKey(name)));
    }

    @Override
    public void delete(String name) {
        send("delete", Request.cmd(Command.DEL).arg(name).arg(ThrottleRequest.knobsKey(name)));
    }

    @Override
    public boolean ping() {
        try {
            return "PONG".equalsIgnoreCase(send("ping", Request.cmd(Command.PING)).toString());
        } catch (StoreUnavailableException e) {
            LOG.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        redis.close();
        if (vertx != null) {
            vertx.closeAndAwait();
        }
    }

    private Response runScript(String operation, LuaScript script, List<String> keys, List<String> args) {
        Uni<Response> evalSha = redis.send(scriptRequest(Command.EVALSHA, script.sha1(), keys, args))
            .onFailure(RedisThrottleStore::isNoScript)
            .recoverWithUni(failure -> {
                LOG.debug("Script {} not cached on server, sending source", script.name());
                return redis.send(scriptRequest(Command.EVAL, script.source(), keys, args));
            });
        return await(operation, evalSha);
    }

    private static Request scriptRequest(Command command, String script, List<String> keys, List<String> args) {
        Request request = Request.cmd(command).arg(script).arg(Integer.toString(keys.size()));
        keys.forEach(request::arg);
        args.forEach(request::arg);
        return request;
    }

    private Response send(String operation, Request request) {
        return await(operation, redis.send(request));
    }

    private Response await(String operation, Uni<Response> uni) {
        Response response;
        try {
            response = uni.await().atMost(timeout);
        } catch (RuntimeException e) {
            throw translate(operation, e);
        }
        if (response == null) {
            throw new StoreUnavailableException(operation, new IllegalStateException("Null response from Redis"));
        }
        return response;
    }

    private void requireStored(String knobsKey, String field, Object newValue) {
        if (newValue != null) {
            return;
        }
        Response exists = send("setKnobs", Request.cmd(Command.HEXISTS).arg(knobsKey).arg(field));
        if (exists.toLong() != 1L) {
            throw new UnknownThrottleException(knobsKey, field);
        }
    }

    private static RuntimeException translate(String operation, RuntimeException failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.startsWith(INVALID_CONFIGURATION)) {
                return new InvalidConfigurationException(message.substring(INVALID_CONFIGURATION.length()).trim());
            }
        }
        LOG.debug("Redis {} failed", operation, failure);
        return new StoreUnavailableException(operation, failure);
    }

    private static boolean isNoScript(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().startsWith(NO_SCRIPT)) {
                return true;
            }
        }
        return false;
    }

    private static void requireCounterArgs(String key, long intervalSeconds, int periods) {
        if (key == null || key.isEmpty()) throw new IllegalArgumentException("key must not be empty");
        if (intervalSeconds <= 0) throw new IllegalArgumentException("interval must be > 0");
        if (periods <= 0) throw new IllegalArgumentException("periods must be > 0");
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static Long toLong(Response value) {
        return value == null ? null : (long) Double.parseDouble(value.toString());
    }

    private static Double toDouble(Response value) {
        return value == null ? null : Double.parseDouble(value.toString());
    }
}
