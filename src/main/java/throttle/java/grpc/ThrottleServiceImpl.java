package throttle.java.grpc;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import throttle.core.model.CounterBuckets;
import throttle.core.model.InvalidConfigurationException;
import throttle.core.model.KnobUpdate;
import throttle.core.model.StoreUnavailableException;
import throttle.core.model.ThrottleRequest;
import throttle.core.model.ThrottleResult;
import throttle.core.model.ThrottleSnapshot;
import throttle.core.model.UnknownThrottleException;
import throttle.java.engine.CounterCounts;
import throttle.java.engine.RunningCounter;
import throttle.java.engine.ThrottleDefaults;
import throttle.java.engine.ThrottleOptions;
import throttle.java.engine.Throttles;
import throttle.java.store.ThrottleStore;
import throttle.proto.BucketCount;
import throttle.proto.CountsResponse;
import throttle.proto.Empty;
import throttle.proto.EvaluateRequest;
import throttle.proto.EvaluateResponse;
import throttle.proto.GetBucketsRequest;
import throttle.proto.GetBucketsResponse;
import throttle.proto.GetThrottleResponse;
import throttle.proto.HealthCheckRequest;
import throttle.proto.HealthCheckResponse;
import throttle.proto.IncrementRequest;
import throttle.proto.IncrementResponse;
import throttle.proto.SetKnobsRequest;
import throttle.proto.SetKnobsResponse;
import throttle.proto.ThrottleNameRequest;
import throttle.proto.ThrottleServiceGrpc;

import java.util.Map;
import java.util.function.Supplier;

/**
 * gRPC service implementation for throttles and running counters.
 *
 * <p>This is a thin wrapper over {@link Throttles} and {@link RunningCounter} with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Error mapping: invalid stored knobs → FAILED_PRECONDITION, unknown knob → NOT_FOUND,
 *       store failure → UNAVAILABLE, anything else → INTERNAL</li>
 *   <li>Protobuf conversion of results</li>
 * </ul>
 *
 * <p>Thread-safety: the store provides atomicity, so this service is stateless and can handle
 * concurrent RPCs.
 */
public final class ThrottleServiceImpl extends ThrottleServiceGrpc.ThrottleServiceImplBase {

    private static final Logger LOG = LoggerFactory.getLogger(ThrottleServiceImpl.class);

    private final ThrottleStore store;
    private final Throttles throttles;
    private final RunningCounter counter;
    private final long defaultKnobsTtlSeconds;

    public ThrottleServiceImpl(ThrottleStore store, Throttles throttles, RunningCounter counter) {
        this(store, throttles, counter, ThrottleDefaults.KNOBS_TTL_SECONDS);
    }

    /**
     * @param store Store used for health checks
     * @param throttles Named throttles over the same store
     * @param counter Running counters over the same store
     * @param defaultKnobsTtlSeconds Knobs TTL used when a request does not carry one
     * @throws IllegalArgumentException if any collaborator is null
     */
    public ThrottleServiceImpl(ThrottleStore store, Throttles throttles, RunningCounter counter, long defaultKnobsTtlSeconds) {
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (throttles == null) throw new IllegalArgumentException("throttles cannot be null");
        if (counter == null) throw new IllegalArgumentException("counter cannot be null");
        if (defaultKnobsTtlSeconds < 0 || defaultKnobsTtlSeconds > ThrottleRequest.MAX_KNOBS_TTL_SECONDS) {
            throw new IllegalArgumentException("defaultKnobsTtlSeconds must be in [0, " + ThrottleRequest.MAX_KNOBS_TTL_SECONDS + "]");
        }
        this.store = store;
        this.throttles = throttles;
        this.counter = counter;
        this.defaultKnobsTtlSeconds = defaultKnobsTtlSeconds;
    }

    @Override
    public void evaluate(EvaluateRequest request, StreamObserver<EvaluateResponse> responseObserver) {
        respond(responseObserver, () -> {
            requireName(request.getName());
            ThrottleOptions options = new ThrottleOptions(
                request.getRps(),
                request.hasBurst() ? request.getBurst() : ThrottleDefaults.BURST,
                request.hasWindow() ? request.getWindow() : ThrottleDefaults.WINDOW_SECONDS,
                request.hasRequestedTokens() ? request.getRequestedTokens() : ThrottleDefaults.REQUESTED_TOKENS,
                request.hasKnobsTtlSeconds() ? request.getKnobsTtlSeconds() : defaultKnobsTtlSeconds
            );

            ThrottleResult result = throttles.throttle(request.getName(), options);
            return EvaluateResponse.newBuilder()
                .setAllowed(result.allowed())
                .setTokens(result.tokens())
                .setSecondsUntilCapacity(result.secondsUntilCapacity().toPlainString())
                .build();
        });
    }

    @Override
    public void increment(IncrementRequest request, StreamObserver<IncrementResponse> responseObserver) {
        respond(responseObserver, () -> {
            requireKey(request.getKey());
            counter.update(
                request.getKey(),
                request.getIntervalSeconds(),
                request.getPeriods(),
                request.hasAmount() ? request.getAmount() : 1.0
            );
            return IncrementResponse.getDefaultInstance();
        });
    }

    @Override
    public void getBuckets(GetBucketsRequest request, StreamObserver<GetBucketsResponse> responseObserver) {
        respond(responseObserver, () -> {
            requireKey(request.getKey());
            CounterBuckets buckets = counter.buckets(request.getKey(), request.getIntervalSeconds(), request.getPeriods());
            return GetBucketsResponse.newBuilder()
                .setCurrentBucket(buckets.currentBucket())
                .addAllLiveBuckets(buckets.liveBuckets())
                .build();
        });
    }

    @Override
    public void counts(GetBucketsRequest request, StreamObserver<CountsResponse> responseObserver) {
        respond(responseObserver, () -> {
            requireKey(request.getKey());
            CounterCounts counts = counter.counts(request.getKey(), request.getIntervalSeconds(), request.getPeriods());
            CountsResponse.Builder response = CountsResponse.newBuilder()
                .setCurrentBucket(counts.currentBucket())
                .setTotal(counts.total());
            for (Map.Entry<Long, Double> bucket : counts.buckets().entrySet()) {
                response.addBuckets(BucketCount.newBuilder()
                    .setBucket(bucket.getKey())
                    .setValue(bucket.getValue()));
            }
            return response.build();
        });
    }

    @Override
    public void setKnobs(SetKnobsRequest request, StreamObserver<SetKnobsResponse> responseObserver) {
        respond(responseObserver, () -> {
            requireName(request.getName());
            KnobUpdate update = new KnobUpdate(
                request.hasRps() ? request.getRps() : null,
                request.hasBurst() ? request.getBurst() : null,
                request.hasWindow() ? request.getWindow() : null,
                request.hasTtlSeconds() ? request.getTtlSeconds() : null
            );
            throttles.set(request.getName(), update);
            return SetKnobsResponse.getDefaultInstance();
        });
    }

    @Override
    public void getThrottle(ThrottleNameRequest request, StreamObserver<GetThrottleResponse> responseObserver) {
        respond(responseObserver, () -> {
            requireName(request.getName());
            ThrottleSnapshot snapshot = throttles.get(request.getName());
            GetThrottleResponse.Builder response = GetThrottleResponse.newBuilder();
            if (snapshot.tokens() != null) response.setTokens(snapshot.tokens());
            if (snapshot.refreshed() != null) response.setRefreshed(snapshot.refreshed());
            if (snapshot.rps() != null) response.setRps(snapshot.rps());
            if (snapshot.burst() != null) response.setBurst(snapshot.burst());
            if (snapshot.window() != null) response.setWindow(snapshot.window());
            return response.build();
        });
    }

    @Override
    public void resetKnobs(ThrottleNameRequest request, StreamObserver<Empty> responseObserver) {
        respond(responseObserver, () -> {
            requireName(request.getName());
            throttles.reset(request.getName());
            return Empty.getDefaultInstance();
        });
    }

    @Override
    public void deleteThrottle(ThrottleNameRequest request, StreamObserver<Empty> responseObserver) {
        respond(responseObserver, () -> {
            requireName(request.getName());
            throttles.delete(request.getName());
            return Empty.getDefaultInstance();
        });
    }

    @Override
    public void healthCheck(HealthCheckRequest request, StreamObserver<HealthCheckResponse> responseObserver) {
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(store.ping() ? HealthCheckResponse.Status.SERVING : HealthCheckResponse.Status.NOT_SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    private static <T> void respond(StreamObserver<T> responseObserver, Supplier<T> call) {
        T response;
        try {
            response = call.get();
        } catch (UnknownThrottleException e) {
            responseObserver.onError(Status.NOT_FOUND.withDescription(e.getMessage()).withCause(e).asRuntimeException());
            return;
        } catch (InvalidConfigurationException e) {
            responseObserver.onError(Status.FAILED_PRECONDITION.withDescription(e.getMessage()).withCause(e).asRuntimeException());
            return;
        } catch (StoreUnavailableException e) {
            LOG.warn("Store unavailable: {}", e.getMessage());
            responseObserver.onError(Status.UNAVAILABLE.withDescription(e.getMessage()).withCause(e).asRuntimeException());
            return;
        } catch (IllegalArgumentException e) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription(e.getMessage()).withCause(e).asRuntimeException());
            return;
        } catch (Exception e) {
            LOG.error("Unexpected error", e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    // Protobuf strings are never null, only empty
    private static void requireName(String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
    }

    private static void requireKey(String key) {
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
    }
}
