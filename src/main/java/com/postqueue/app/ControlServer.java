package com.postqueue.app;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.postqueue.core.ExecutionRecord;
import com.postqueue.core.InvalidScheduleException;
import com.postqueue.core.Job;
import com.postqueue.core.JobNotFoundException;
import com.postqueue.core.JobSpec;
import com.postqueue.core.PersistenceException;
import com.postqueue.core.Schedule;
import com.postqueue.core.ScheduleKind;
import com.postqueue.db.HistoryRecorder;
import com.postqueue.engine.ActiveJob;
import com.postqueue.engine.SchedulerEngine;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP control surface for the scheduler.
 *
 * <p><b>Endpoints:</b></p>
 * <ul>
 *   <li>{@code GET /health}</li>
 *   <li>{@code GET /schedules?active=&target=&limit=&offset=}, {@code GET /schedules/{id}}</li>
 *   <li>{@code POST /schedules}, {@code PUT /schedules/{id}}, {@code DELETE /schedules/{id}}</li>
 *   <li>{@code GET /triggers}: live trigger count and list</li>
 *   <li>{@code GET /history?target=&limit=}, {@code GET /history/failures?hours=}</li>
 * </ul>
 *
 * <p>Errors are returned as {@code {"error": code, "message": detail}}:
 * 400 for invalid schedules and malformed requests, 404 for unknown jobs,
 * 500 for storage failures.</p>
 */
public class ControlServer {
    private static final Logger logger = Logger.getLogger(ControlServer.class.getName());

    static final int MAX_PAGE_SIZE = 100;
    private static final int DEFAULT_PAGE_SIZE = 50;

    private final SchedulerEngine engine;
    private final HistoryRecorder history;
    private final HealthService healthService;
    private final Clock clock;
    private final int port;
    private final Gson gson = new GsonBuilder().serializeNulls().create();
    private HttpServer server;
    private ExecutorService executor;

    public ControlServer(SchedulerEngine engine, HistoryRecorder history, HealthService healthService,
                         Clock clock, int port) {
        this.engine = engine;
        this.history = history;
        this.healthService = healthService;
        this.clock = clock;
        this.port = port;
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/health", new JsonHandler(this::handleHealth));
        server.createContext("/schedules", new JsonHandler(this::handleSchedules));
        server.createContext("/triggers", new JsonHandler(this::handleTriggers));
        server.createContext("/history", new JsonHandler(this::handleHistory));

        executor = Executors.newFixedThreadPool(4);
        server.setExecutor(executor);
        server.start();

        logger.info("Control server started on port " + getPort());
    }

    public void stop() {
        if (server != null) {
            server.stop(2);
            executor.shutdown();
            logger.info("Control server stopped");
        }
    }

    /**
     * @return the bound port, which differs from the configured one when that was 0
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    // ---- routes ----

    private Response handleHealth(HttpExchange exchange) {
        requireMethod(exchange, "GET");
        HealthService.HealthReport report = healthService.check();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("healthy", report.isHealthy());
        body.put("activeTriggers", report.getActiveTriggers());
        body.put("webhooksActive", report.getWebhooksActive());
        body.put("recentFailures", report.getRecentFailures());
        body.put("warning", report.isWarning());
        body.put("lastCheck", report.getLastCheck().toString());
        if (report.getError() != null) {
            body.put("error", report.getError());
        }
        return new Response(report.isHealthy() ? 200 : 503, body);
    }

    private Response handleSchedules(HttpExchange exchange) throws PersistenceException, IOException {
        String id = pathId(exchange, "/schedules");
        String method = exchange.getRequestMethod().toUpperCase();

        if (id == null) {
            switch (method) {
                case "GET":
                    return listSchedules(exchange);
                case "POST":
                    return createSchedule(exchange);
                default:
                    throw new MethodNotAllowed();
            }
        }

        switch (method) {
            case "GET":
                return new Response(200, toDto(engine.get(id)));
            case "PUT":
                return updateSchedule(exchange, id);
            case "DELETE":
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("cancelled", engine.cancel(id));
                return new Response(200, body);
            default:
                throw new MethodNotAllowed();
        }
    }

    private Response listSchedules(HttpExchange exchange) throws PersistenceException {
        Map<String, String> query = parseQuery(exchange);
        Boolean active = query.containsKey("active") ? Boolean.valueOf(query.get("active")) : null;
        int limit = Math.min(intParam(query, "limit", DEFAULT_PAGE_SIZE), MAX_PAGE_SIZE);
        int offset = intParam(query, "offset", 0);
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }

        List<Map<String, Object>> jobs = new ArrayList<>();
        for (Job job : engine.list(active, query.get("target"), limit, offset)) {
            jobs.add(toDto(job));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("schedules", jobs);
        body.put("limit", limit);
        body.put("offset", offset);
        return new Response(200, body);
    }

    private Response createSchedule(HttpExchange exchange) throws PersistenceException, IOException {
        ScheduleRequest request = readBody(exchange);
        if (request.target == null || request.target.isBlank()) {
            throw new IllegalArgumentException("target is required");
        }
        String payload = request.payloadText();
        if (payload == null) {
            throw new IllegalArgumentException("payload is required");
        }
        Schedule schedule = request.toSchedule();
        if (schedule == null) {
            throw new IllegalArgumentException("either runAt or cron is required");
        }

        Job job = engine.add(new JobSpec(request.target, payload, schedule, request.createdBy));
        return new Response(201, toDto(job));
    }

    private Response updateSchedule(HttpExchange exchange, String id) throws PersistenceException, IOException {
        ScheduleRequest request = readBody(exchange);
        Schedule schedule = request.toSchedule();
        String payload = request.payloadText();
        if (schedule == null && payload == null) {
            throw new IllegalArgumentException("nothing to update: give runAt, cron or payload");
        }

        Job job = engine.update(id, schedule, payload);
        return new Response(200, toDto(job));
    }

    private Response handleTriggers(HttpExchange exchange) {
        requireMethod(exchange, "GET");
        List<Map<String, Object>> triggers = new ArrayList<>();
        for (ActiveJob active : engine.listActive()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("jobId", active.getJobId());
            entry.put("kind", active.getKind().getDisplayName());
            entry.put("nextFireTime", format(active.getNextFireTime()));
            triggers.add(entry);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", engine.countActive());
        body.put("triggers", triggers);
        return new Response(200, body);
    }

    private Response handleHistory(HttpExchange exchange) throws PersistenceException {
        requireMethod(exchange, "GET");
        Map<String, String> query = parseQuery(exchange);
        String path = exchange.getRequestURI().getPath();

        List<ExecutionRecord> records;
        if (path.equals("/history/failures")) {
            int hours = intParam(query, "hours", 24);
            records = history.failuresSince(clock.instant().minus(Duration.ofHours(hours)));
        } else if (path.equals("/history") || path.equals("/history/")) {
            int limit = Math.min(intParam(query, "limit", DEFAULT_PAGE_SIZE), MAX_PAGE_SIZE);
            records = history.recent(query.get("target"), limit);
        } else {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "not_found");
            body.put("message", "No such resource: " + path);
            return new Response(404, body);
        }

        List<Map<String, Object>> entries = new ArrayList<>();
        for (ExecutionRecord record : records) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", record.getId());
            entry.put("jobId", record.getJobId());
            entry.put("target", record.getTarget());
            entry.put("executedAt", format(record.getExecutedAt()));
            entry.put("success", record.isSuccess());
            entry.put("errorMessage", record.getErrorMessage());
            entry.put("receiptId", record.getReceiptId());
            entries.add(entry);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", entries.size());
        body.put("history", entries);
        return new Response(200, body);
    }

    // ---- helpers ----

    private Map<String, Object> toDto(Job job) {
        Map<String, Object> dto = new LinkedHashMap<>();
        dto.put("id", job.getId());
        dto.put("target", job.getTarget());
        dto.put("payload", job.getPayload());
        dto.put("type", job.getKind().getDisplayName());
        if (job.getKind() == ScheduleKind.ONE_TIME) {
            dto.put("runAt", format(job.getSchedule().asOneTime().getAt()));
        } else {
            Schedule.Recurring recurring = job.getSchedule().asRecurring();
            dto.put("cron", recurring.getCronExpression());
            dto.put("timeZone", recurring.getZone().getId());
        }
        dto.put("active", job.isActive());
        dto.put("armed", engine.isArmed(job.getId()));
        dto.put("createdBy", job.getCreatedBy());
        dto.put("lastExecuted", format(job.getLastExecuted()));
        dto.put("createdAt", format(job.getCreatedAt()));
        dto.put("updatedAt", format(job.getUpdatedAt()));
        return dto;
    }

    private ScheduleRequest readBody(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            String body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            if (body.isBlank()) {
                throw new IllegalArgumentException("request body is required");
            }
            ScheduleRequest request = gson.fromJson(body, ScheduleRequest.class);
            if (request == null) {
                throw new IllegalArgumentException("request body is required");
            }
            return request;
        }
    }

    private static String pathId(HttpExchange exchange, String prefix) {
        String path = exchange.getRequestURI().getPath();
        String rest = path.length() > prefix.length() ? path.substring(prefix.length()) : "";
        if (rest.isEmpty() || rest.equals("/")) {
            return null;
        }
        String id = rest.substring(1);
        if (id.endsWith("/")) {
            id = id.substring(0, id.length() - 1);
        }
        return id;
    }

    static Map<String, String> parseQuery(HttpExchange exchange) {
        Map<String, String> params = new HashMap<>();
        String raw = exchange.getRequestURI().getRawQuery();
        if (raw == null || raw.isEmpty()) {
            return params;
        }
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private static int intParam(Map<String, String> query, String name, int defaultValue) {
        String value = query.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }

    private static void requireMethod(HttpExchange exchange, String method) {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            throw new MethodNotAllowed();
        }
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private void send(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] response = gson.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String error, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        send(exchange, statusCode, body);
    }

    @FunctionalInterface
    private interface Route {
        Response handle(HttpExchange exchange) throws PersistenceException, IOException;
    }

    private static final class Response {
        private final int status;
        private final Object body;

        Response(int status, Object body) {
            this.status = status;
            this.body = body;
        }
    }

    private static final class MethodNotAllowed extends RuntimeException {
        MethodNotAllowed() {
            super("Method Not Allowed");
        }
    }

    // Maps the error taxonomy onto HTTP status codes
    private class JsonHandler implements HttpHandler {
        private final Route route;

        JsonHandler(Route route) {
            this.route = route;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                Response response = route.handle(exchange);
                send(exchange, response.status, response.body);
                logger.fine("Served " + exchange.getRequestMethod() + " " + exchange.getRequestURI());
            } catch (MethodNotAllowed e) {
                sendError(exchange, 405, "method_not_allowed", exchange.getRequestMethod() + " is not supported here");
            } catch (InvalidScheduleException e) {
                sendError(exchange, 400, "invalid_schedule", e.getMessage());
            } catch (JobNotFoundException e) {
                sendError(exchange, 404, "not_found", e.getMessage());
            } catch (IllegalArgumentException | JsonParseException e) {
                sendError(exchange, 400, "bad_request", e.getMessage());
            } catch (IllegalStateException e) {
                sendError(exchange, 503, "unavailable", e.getMessage());
            } catch (PersistenceException e) {
                logger.log(Level.SEVERE, "Storage failure serving " + exchange.getRequestURI(), e);
                sendError(exchange, 500, "persistence_error", e.getMessage());
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Unexpected error handling request", e);
                sendError(exchange, 500, "internal_error", "Internal Server Error");
            } finally {
                exchange.close();
            }
        }
    }

    /**
     * Request body for {@code POST /schedules} and {@code PUT /schedules/{id}}.
     * {@code payload} may be a string or a JSON object.
     */
    static final class ScheduleRequest {
        String target;
        JsonElement payload;
        String createdBy;
        String runAt;
        String cron;
        String timeZone;

        String payloadText() {
            if (payload == null || payload.isJsonNull()) {
                return null;
            }
            return payload.isJsonPrimitive() ? payload.getAsString() : payload.toString();
        }

        Schedule toSchedule() {
            if (runAt != null && cron != null) {
                throw new InvalidScheduleException("Give either runAt or cron, not both");
            }
            if (runAt != null) {
                return Schedule.oneTime(parseInstant(runAt));
            }
            if (cron != null) {
                if (timeZone == null || timeZone.isBlank()) {
                    return Schedule.recurring(cron);
                }
                try {
                    return Schedule.recurring(cron, ZoneId.of(timeZone));
                } catch (DateTimeException e) {
                    throw new InvalidScheduleException("Unknown time zone: " + timeZone, timeZone, e);
                }
            }
            return null;
        }

        private static Instant parseInstant(String value) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeException e) {
                throw new InvalidScheduleException("runAt must be an ISO-8601 timestamp with offset", value, e);
            }
        }
    }
}
