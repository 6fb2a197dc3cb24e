package com.logsentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.exception.InvalidQueryException;
import com.logsentinel.core.exception.QueryFailedException;
import com.logsentinel.core.query.HistoryQueryService;
import com.logsentinel.core.query.OccurrenceQuery;
import com.logsentinel.core.query.OccurrenceReport;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server for health probes and the history query interface.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200 OK} with body {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness} – same; Kubernetes readiness check target</li>
 * <li>{@code GET /history?level=ERROR&message=...&hours=24} or
 * {@code GET /history?signature=ERROR:%20...&hours=24} – occurrence count of
 * a signature; {@code 400} with {@code {"message":...}} on malformed input,
 * {@code 500} when the store cannot be read</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class QueryServer {

    private static final Logger LOG = LoggerFactory.getLogger(QueryServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final HistoryQueryService queryService;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService executor;

    public QueryServer(HistoryQueryService queryService) {
        this.queryService = Objects.requireNonNull(queryService, "HistoryQueryService must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Query server port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind query server on port " + port, e);
        }
        server.createContext("/health", QueryServer::handleHealthCheck);
        server.createContext("/readiness", QueryServer::handleHealthCheck);
        server.createContext("/history", this::handleHistory);

        executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "query-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("Query server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Query server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     * @throws IllegalStateException if the server was never started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Query server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        send(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleHistory(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed: " + exchange.getRequestMethod());
            return;
        }
        try {
            OccurrenceReport report = queryService.query(toQuery(exchange.getRequestURI().getRawQuery()));
            send(exchange, 200, mapper.writeValueAsBytes(report));
        } catch (InvalidQueryException e) {
            sendError(exchange, 400, e.getMessage());
        } catch (QueryFailedException e) {
            sendError(exchange, 500, e.getMessage());
        }
    }

    static OccurrenceQuery toQuery(String rawQuery) {
        Map<String, String> params = parseParams(rawQuery);
        Integer hours = null;
        String hoursParam = params.get("hours");
        if (hoursParam != null && !hoursParam.isBlank()) {
            try {
                hours = Integer.valueOf(hoursParam.strip());
            } catch (NumberFormatException e) {
                throw new InvalidQueryException("hours must be a positive integer, got: '" + hoursParam + "'", e);
            }
        }
        if (params.containsKey("signature")) {
            return OccurrenceQuery.ofSignature(params.get("signature"), hours);
        }
        return OccurrenceQuery.of(params.get("level"), params.get("message"), hours);
    }

    private static Map<String, String> parseParams(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int idx = pair.indexOf('=');
            String name = idx >= 0 ? pair.substring(0, idx) : pair;
            String value = idx >= 0 ? pair.substring(idx + 1) : "";
            params.putIfAbsent(URLDecoder.decode(name, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        LOG.debug("History request {} -> {}: {}", exchange.getRequestURI(), status, message);
        send(exchange, status, mapper.writeValueAsBytes(Map.of("message", String.valueOf(message))));
    }

    private static void send(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
