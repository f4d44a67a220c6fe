package com.outbreaksentinel.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.outbreaksentinel.core.alert.AlertLifecycleManager;
import com.outbreaksentinel.core.alert.AlertNotFoundException;
import com.outbreaksentinel.core.alert.AlertPersistenceException;
import com.outbreaksentinel.core.alert.InvalidTransitionException;
import com.outbreaksentinel.core.model.AlertStatus;
import com.outbreaksentinel.core.runner.PipelineRunner;
import com.outbreaksentinel.core.runner.PipelineScheduler;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server for health checks, run triggers, run status and alert
 * status changes.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}, {@code GET /readiness} – {@code {"status":"UP"}}</li>
 * <li>{@code POST /runs} – queue a manual run, {@code 202}</li>
 * <li>{@code GET /runs} – recent run reports, most recent first</li>
 * <li>{@code GET /runs/latest} – the run in progress, else the last one</li>
 * <li>{@code GET /alerts?location=X} – alerts of a location</li>
 * <li>{@code GET /alerts/{id}} – one alert</li>
 * <li>{@code POST /alerts/{id}/status} – body {@code {"status":"acknowledged"}};
 * {@code 409} for a transition the lifecycle forbids</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external dependencies
 * (Jetty, Netty, etc.) are required.
 * </p>
 *
 * @since 1.0.0
 */
public class ControlServer {

    private static final Logger LOG = LoggerFactory.getLogger(ControlServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final PipelineScheduler scheduler;
    private final AlertLifecycleManager lifecycle;
    private final ObjectMapper mapper;

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ControlServer(PipelineScheduler scheduler, AlertLifecycleManager lifecycle) {
        this.scheduler = Objects.requireNonNull(scheduler, "PipelineScheduler must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "AlertLifecycleManager must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Start the control server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Control port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start control server on port " + port, e);
        }
        server.createContext("/health", ControlServer::handleHealthCheck);
        server.createContext("/readiness", ControlServer::handleHealthCheck);
        server.createContext("/runs", this::handleRuns);
        server.createContext("/alerts", this::handleAlerts);

        server.setExecutor(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "control-server");
            t.setDaemon(true);
            return t;
        }));

        server.start();
        running.set(true);
        LOG.info("Control server started on port {}", getPort());
    }

    /**
     * Stop the control server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Control server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /** Bound port, or {@code -1} before {@link #start(int)}. */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, HEALTH_RESPONSE.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(HEALTH_RESPONSE);
        }
    }

    private void handleRuns(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String method = exchange.getRequestMethod();
        PipelineRunner runner = scheduler.getRunner();

        if (path.equals("/runs") && method.equals("POST")) {
            scheduler.runNow().whenComplete((report, error) -> {
                if (error != null) {
                    LOG.error("Manual run failed", error);
                }
            });
            respond(exchange, 202, Map.of("status", "accepted"));
        } else if (path.equals("/runs") && method.equals("GET")) {
            respond(exchange, 200, runner.history());
        } else if (path.equals("/runs/latest") && method.equals("GET")) {
            Optional<?> report = runner.currentRun().isPresent() ? runner.currentRun() : runner.lastRun();
            if (report.isPresent()) {
                respond(exchange, 200, report.get());
            } else {
                respond(exchange, 404, error("no run yet"));
            }
        } else {
            respond(exchange, 404, error("unknown endpoint " + method + " " + path));
        }
    }

    private void handleAlerts(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String method = exchange.getRequestMethod();
        String[] parts = path.substring(1).split("/");
        try {
            if (parts.length == 1 && method.equals("GET")) {
                String location = queryParam(exchange, "location");
                if (location == null || location.isBlank()) {
                    respond(exchange, 400, error("query parameter 'location' is required"));
                } else {
                    respond(exchange, 200, lifecycle.alertsForLocation(location));
                }
            } else if (parts.length == 2 && method.equals("GET")) {
                Optional<?> alert = lifecycle.find(parts[1]);
                if (alert.isPresent()) {
                    respond(exchange, 200, alert.get());
                } else {
                    respond(exchange, 404, error("alert " + parts[1] + " not found"));
                }
            } else if (parts.length == 3 && parts[2].equals("status") && method.equals("POST")) {
                AlertStatus target = readStatus(exchange);
                respond(exchange, 200, lifecycle.transition(parts[1], target));
            } else {
                respond(exchange, 404, error("unknown endpoint " + method + " " + path));
            }
        } catch (AlertNotFoundException e) {
            respond(exchange, 404, error(e.getMessage()));
        } catch (InvalidTransitionException e) {
            respond(exchange, 409, error(e.getMessage()));
        } catch (IllegalArgumentException e) {
            respond(exchange, 400, error(e.getMessage()));
        } catch (AlertPersistenceException e) {
            LOG.error("Alert store unavailable for {} {}", method, path, e);
            respond(exchange, 503, error(e.getMessage()));
        }
    }

    private AlertStatus readStatus(HttpExchange exchange) throws IOException {
        JsonNode body;
        try (InputStream in = exchange.getRequestBody()) {
            body = mapper.readTree(in);
        } catch (IOException e) {
            throw new IllegalArgumentException("Request body must be JSON: " + e.getMessage(), e);
        }
        if (body == null || !body.hasNonNull("status")) {
            throw new IllegalArgumentException("Request body requires 'status'");
        }
        return AlertStatus.fromKey(body.get("status").asText());
    }

    private static String queryParam(HttpExchange exchange, String name) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name)) {
                return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return body;
    }

    private void respond(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
