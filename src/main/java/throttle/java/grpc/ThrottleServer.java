package throttle.java.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import throttle.java.config.ThrottleServerConfig;
import throttle.java.engine.RunningCounter;
import throttle.java.engine.ThrottleStoreFactory;
import throttle.java.engine.Throttles;
import throttle.java.store.ThrottleStore;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Standalone gRPC server for throttles and running counters.
 *
 * <p>Features:
 * <ul>
 *   <li>Configuration from THROTTLE_* environment variables (see {@link ThrottleServerConfig})</li>
 *   <li>Redis or in-memory store</li>
 *   <li>Graceful shutdown with timeout; the store is closed after the server stops</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * THROTTLE_STORE=redis THROTTLE_REDIS_URL=redis://cache:6379 java throttle.java.grpc.ThrottleServer
 * </pre>
 */
public final class ThrottleServer {

    private static final Logger LOG = LoggerFactory.getLogger(ThrottleServer.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final ThrottleStore store;
    private final AtomicBoolean stopped = new AtomicBoolean();

    /**
     * Creates a server and the store named by the configuration.
     */
    public ThrottleServer(ThrottleServerConfig config) {
        this(config, ThrottleStoreFactory.create(config));
    }

    /**
     * Creates a server over an existing store (useful for testing). The server takes ownership of the store.
     *
     * @param config Server configuration
     * @param store Store backing the service
     */
    public ThrottleServer(ThrottleServerConfig config, ThrottleStore store) {
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        this.store = store;
        Throttles throttles = new Throttles(store, config.failurePolicy(), config.persistDefaults());
        this.server = ServerBuilder.forPort(config.port())
            .addService(new ThrottleServiceImpl(store, throttles, new RunningCounter(store), config.knobsTtlSeconds()))
            .build();
    }

    /**
     * Starts the server.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        LOG.info("ThrottleServer started on port: {}", server.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                ThrottleServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Shutdown interrupted: {}", e.getMessage());
            }
        }));
    }

    /**
     * Stops the server gracefully, then closes the store.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Server did not terminate in {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                server.shutdownNow();
            }
        } finally {
            store.close();
        }
        LOG.info("ThrottleServer stopped.");
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        ThrottleServerConfig config = ThrottleServerConfig.fromEnv();
        LOG.info("Starting with store={} port={} failurePolicy={}", config.storeType(), config.port(), config.failurePolicy());

        ThrottleServer server = new ThrottleServer(config);
        server.start();
        server.blockUntilShutdown();
    }
}
