package com.telemetrysentinel.monitor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server that exposes health and metrics endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} - {@code {"status":"UP","state":"WATCHING","checkedAt":...}};
 * status is {@code DOWN} once the pipeline is draining or stopped</li>
 * <li>{@code GET /metrics} - the {@link PipelineMetrics#snapshot()} as JSON</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private final Supplier<PipelineState> state;
    private final PipelineMetrics metrics;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService executor;

    public HealthServer(Supplier<PipelineState> state, PipelineMetrics metrics) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to; must be in range [0, 65535], 0 picks a
     *             free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IOException              if the port cannot be bound
     */
    public void start(int port) throws IOException {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", this::handleHealth);
        server.createContext("/metrics", this::handleMetrics);

        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "health-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("Health server started on port {}", getPort());
    }

    /**
     * Stop the server. Idempotent.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or -1 if not started
     */
    public int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        PipelineState current = state.get();
        boolean up = current == PipelineState.FITTED || current == PipelineState.WATCHING;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", up ? "UP" : "DOWN");
        body.put("state", current.name());
        body.put("checkedAt", Instant.now());
        respond(exchange, up ? 200 : 503, body);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        respond(exchange, 200, metrics.snapshot());
    }

    private static void respond(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
