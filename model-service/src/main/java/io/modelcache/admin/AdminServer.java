package io.modelcache.admin;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Snapshot;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.util.JsonFormat;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.modelcache.error.ResourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP admin endpoints under {@code /models}, plus {@code /metrics} and {@code /health}.
 * Bodies are the admin proto messages printed as JSON with their proto field names.
 */
public class AdminServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AdminServer.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final JsonFormat.Printer PRINTER = JsonFormat.printer()
            .preservingProtoFieldNames()
            .includingDefaultValueFields();

    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ModelAdmin admin;
    private final MetricRegistry registry;

    public AdminServer(int port, ModelAdmin admin, MetricRegistry registry) throws IOException {
        this.admin = admin;
        this.registry = registry;
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/models/config", new ExactPath("GET", ex -> sendProto(ex, admin.config())));
        server.createContext("/models/status", new ExactPath("GET", ex -> sendProto(ex, admin.status())));
        server.createContext("/models/select", new ExactPath("POST", this::select));
        server.createContext("/models/validate", new ExactPath("POST", ex -> sendProto(ex, admin.validateBudget())));
        server.createContext("/models/load/", new TaskPath("/models/load/", this::load));
        server.createContext("/models/unload/", new TaskPath("/models/unload/", this::unload));
        server.createContext("/metrics", new ExactPath("GET", this::metrics));
        server.createContext("/health", new ExactPath("GET", ex -> sendProto(ex, admin.health())));
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        log.info("HTTP admin listening on {}", port());
    }

    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    @FunctionalInterface
    private interface Action {
        void handle(HttpExchange exchange) throws IOException, ResourceException, InterruptedException;
    }

    @FunctionalInterface
    private interface TaskAction {
        void handle(HttpExchange exchange, String taskId) throws IOException, ResourceException, InterruptedException;
    }

    private void select(HttpExchange exchange) throws IOException, ResourceException, InterruptedException {
        Map<String, String> q = query(exchange);
        String task = q.getOrDefault("task", q.get("task_type"));
        String option = q.getOrDefault("option", q.get("model_name"));
        if (task == null || option == null) {
            sendError(exchange, 400, "BAD_REQUEST", "select requires 'task' and 'option' query parameters");
            return;
        }
        sendProto(exchange, admin.select(task, option));
    }

    private void load(HttpExchange exchange, String taskId) throws IOException, ResourceException, InterruptedException {
        sendProto(exchange, admin.load(taskId));
    }

    private void unload(HttpExchange exchange, String taskId) throws IOException, ResourceException {
        sendProto(exchange, admin.unload(taskId));
    }

    private void metrics(HttpExchange exchange) throws IOException {
        Map<String, Object> out = new LinkedHashMap<>();
        Map<String, Object> counters = new LinkedHashMap<>();
        for (Map.Entry<String, Counter> e : registry.getCounters().entrySet()) counters.put(e.getKey(), e.getValue().getCount());
        Map<String, Object> gauges = new LinkedHashMap<>();
        for (Map.Entry<String, Gauge> e : registry.getGauges().entrySet()) gauges.put(e.getKey(), e.getValue().getValue());
        Map<String, Object> meters = new LinkedHashMap<>();
        for (Map.Entry<String, Meter> e : registry.getMeters().entrySet()) {
            meters.put(e.getKey(), Map.of("count", e.getValue().getCount(), "rate1m", e.getValue().getOneMinuteRate()));
        }
        Map<String, Object> timers = new LinkedHashMap<>();
        for (Map.Entry<String, Timer> e : registry.getTimers().entrySet()) {
            Snapshot s = e.getValue().getSnapshot();
            Map<String, Object> t = new LinkedHashMap<>();
            t.put("count", e.getValue().getCount());
            t.put("meanMs", nsToMs(s.getMean()));
            t.put("p50Ms", nsToMs(s.getMedian()));
            t.put("p99Ms", nsToMs(s.get99thPercentile()));
            timers.put(e.getKey(), t);
        }
        out.put("counters", counters);
        out.put("gauges", gauges);
        out.put("meters", meters);
        out.put("timers", timers);
        send(exchange, 200, JSON.writeValueAsBytes(out));
    }

    private static double nsToMs(double ns) { return ns / 1_000_000.0; }

    private abstract static class Guarded implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                route(exchange);
            } catch (ResourceException e) {
                log.warn("{} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), e.getMessage());
                sendError(exchange, e.kind().httpStatus(), e.kind().name(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sendError(exchange, 503, "INTERRUPTED", "request interrupted");
            } catch (IllegalStateException e) {
                sendError(exchange, 503, "UNAVAILABLE", e.getMessage());
            } finally {
                exchange.close();
            }
        }

        abstract void route(HttpExchange exchange) throws IOException, ResourceException, InterruptedException;

        static boolean allowed(HttpExchange exchange, String method) throws IOException {
            if (method.equalsIgnoreCase(exchange.getRequestMethod())) return true;
            exchange.getResponseHeaders().add("Allow", method);
            sendError(exchange, 405, "METHOD_NOT_ALLOWED", exchange.getRequestMethod() + " not allowed, use " + method);
            return false;
        }
    }

    private static class ExactPath extends Guarded {
        private final String method;
        private final Action action;

        ExactPath(String method, Action action) { this.method = method; this.action = action; }

        @Override
        void route(HttpExchange exchange) throws IOException, ResourceException, InterruptedException {
            String path = exchange.getRequestURI().getPath();
            if (!path.equals(exchange.getHttpContext().getPath())) {
                sendError(exchange, 404, "NOT_FOUND", "No route for " + path);
                return;
            }
            if (allowed(exchange, method)) action.handle(exchange);
        }
    }

    private static class TaskPath extends Guarded {
        private final String prefix;
        private final TaskAction action;

        TaskPath(String prefix, TaskAction action) { this.prefix = prefix; this.action = action; }

        @Override
        void route(HttpExchange exchange) throws IOException, ResourceException, InterruptedException {
            String taskId = exchange.getRequestURI().getPath().substring(prefix.length());
            if (taskId.isEmpty() || taskId.contains("/")) {
                sendError(exchange, 404, "NOT_FOUND", "Expected " + prefix + "{task}");
                return;
            }
            if (allowed(exchange, "POST")) action.handle(exchange, taskId);
        }
    }

    private static Map<String, String> query(HttpExchange exchange) {
        Map<String, String> out = new HashMap<>();
        String raw = exchange.getRequestURI().getRawQuery();
        if (raw == null) return out;
        for (String part : raw.split("&")) {
            String[] kv = part.split("=", 2);
            if (kv.length == 2) {
                out.put(URLDecoder.decode(kv[0], StandardCharsets.UTF_8), URLDecoder.decode(kv[1], StandardCharsets.UTF_8));
            }
        }
        return out;
    }

    private static void sendProto(HttpExchange exchange, MessageOrBuilder message) throws IOException {
        send(exchange, 200, PRINTER.print(message).getBytes(StandardCharsets.UTF_8));
    }

    private static void sendError(HttpExchange exchange, int status, String kind, String message) throws IOException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", kind);
        body.put("message", message == null ? "" : message);
        send(exchange, status, JSON.writeValueAsBytes(body));
    }

    private static void send(HttpExchange exchange, int status, byte[] bytes) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
    }
}
