package com.docqueue.app;

import com.docqueue.core.ArtifactKind;
import com.docqueue.core.ClaimedJob;
import com.docqueue.core.JobState;
import com.docqueue.core.JobStatusInfo;
import com.docqueue.core.QueueErrorKind;
import com.docqueue.core.QueueException;
import com.docqueue.store.JobStore;
import com.docqueue.store.QueueStats;
import com.docqueue.store.StatsCollector;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import org.json.JSONObject;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP control plane over one queue root.
 *
 * <p>Every queue operation is exposed as a GET endpoint taking query
 * parameters and answering with a short plain-text body:</p>
 * <ul>
 *   <li>{@code /health} → {@code ok}, never gated</li>
 *   <li>{@code /metrics} → stats as JSON</li>
 *   <li>{@code /submit?uuid&pdf&metadata[&priority=1]}, source paths relative to the root</li>
 *   <li>{@code /claim[?prefer_priority=1]} → {@code <uuid> <state>}</li>
 *   <li>{@code /release?uuid&state}</li>
 *   <li>{@code /finalize?uuid&from&to} and {@code /move?uuid&from&to}</li>
 *   <li>{@code /status?uuid} → {@code state=<s> locked=<0|1>}</li>
 *   <li>{@code /retrieve?uuid&state&kind=pdf|metadata|report} streams the unlocked file</li>
 * </ul>
 *
 * <p>Queue errors map to 404 (not found), 400 (invalid argument) and 500 (I/O).
 * Responses never carry stack traces or filesystem paths. When a token is
 * configured, every endpoint except {@code /health} requires
 * {@code Authorization: Bearer <token>} or {@code ?token=<token>}.</p>
 */
public class ControlPlaneServer {
    private static final Logger logger = Logger.getLogger(ControlPlaneServer.class.getName());

    private final JobStore store;
    private final StatsCollector statsCollector;
    private final String bindAddress;
    private final int port;
    private final String token;
    private final int threads;
    private final long startTime;

    private HttpServer server;
    private ExecutorService executor;

    /**
     * @param store the queue to serve
     * @param statsCollector stats source for {@code /metrics}
     * @param bindAddress address to listen on, e.g. "127.0.0.1"
     * @param port port to listen on; 0 picks a free one
     * @param token bearer token, or null to disable authentication
     * @param threads request handler threads
     */
    public ControlPlaneServer(JobStore store, StatsCollector statsCollector, String bindAddress,
                              int port, String token, int threads) {
        this.store = store;
        this.statsCollector = statsCollector;
        this.bindAddress = bindAddress;
        this.port = port;
        this.token = token == null || token.isEmpty() ? null : token;
        this.threads = threads;
        this.startTime = System.currentTimeMillis();
    }

    // Start HTTP server and register endpoints
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);

        server.createContext("/", new Endpoint("/", true) {
            @Override
            int serve(HttpExchange exchange, Map<String, String> query) throws IOException {
                return sendText(exchange, 404, "unknown endpoint\n");
            }
        });
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/submit", new SubmitHandler());
        server.createContext("/claim", new ClaimHandler());
        server.createContext("/release", new ReleaseHandler());
        server.createContext("/finalize", new TransitionHandler("/finalize", true));
        server.createContext("/move", new TransitionHandler("/move", false));
        server.createContext("/status", new StatusHandler());
        server.createContext("/retrieve", new RetrieveHandler());

        executor = Executors.newFixedThreadPool(threads);
        server.setExecutor(executor);
        server.start();

        logger.info("Control plane listening on " + bindAddress + ":" + getPort()
                + " for " + store.getRoot() + (token != null ? " (token required)" : ""));
    }

    // Stop HTTP server gracefully
    public void stop() {
        if (server != null) {
            server.stop(1);
            executor.shutdown();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            logger.info("Control plane stopped");
        }
    }

    /**
     * @return the bound port, which differs from the configured one when that was 0
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Common request handling: exact path match, token check, GET check, query
     * parsing, error mapping and the access log line.
     */
    private abstract class Endpoint implements HttpHandler {
        private final String path;
        private final boolean gated;

        Endpoint(String path, boolean gated) {
            this.path = path;
            this.gated = gated;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            long start = System.nanoTime();
            int status = 500;
            try {
                status = dispatch(exchange);
            } catch (IOException e) {
                logger.log(Level.WARNING, "Failed to answer " + exchange.getRequestURI().getPath(), e);
                throw e;
            } finally {
                exchange.close();
                long millis = (System.nanoTime() - start) / 1_000_000L;
                logger.info(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath()
                        + " " + status + " " + millis + "ms");
            }
        }

        private int dispatch(HttpExchange exchange) throws IOException {
            Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
            if (!path.equals("/") && !path.equals(exchange.getRequestURI().getPath())) {
                return sendText(exchange, 404, "unknown endpoint\n");
            }
            if (gated && !isAuthorized(exchange, query)) {
                logger.warning("Rejected unauthenticated request from " + exchange.getRemoteAddress());
                return sendText(exchange, 401, "unauthorized\n");
            }
            if (gated && !"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                return sendText(exchange, 405, "only GET supported\n");
            }
            try {
                return serve(exchange, query);
            } catch (BadRequestException e) {
                return sendText(exchange, 400, e.getMessage() + "\n");
            } catch (QueueException e) {
                return sendQueueError(exchange, e);
            } catch (IOException e) {
                logger.log(Level.SEVERE, "I/O failure serving " + path, e);
                if (exchange.getResponseCode() == -1) {
                    return sendText(exchange, 500, "io error\n");
                }
                throw e;
            }
        }

        abstract int serve(HttpExchange exchange, Map<String, String> query)
                throws IOException, QueueException, BadRequestException;
    }

    private class HealthHandler extends Endpoint {
        HealthHandler() {
            super("/health", false);
        }

        @Override
        int serve(HttpExchange exchange, Map<String, String> query) throws IOException {
            return sendText(exchange, 200, "ok\n");
        }
    }

    private class MetricsHandler extends Endpoint {
        MetricsHandler() {
            super("/metrics", true);
        }

        @Override
        int serve(HttpExchange exchange, Map<String, String> query) throws IOException {
            QueueStats stats;
            try {
                stats = statsCollector.collect();
            } catch (QueueException e) {
                if (e.getKind() == QueueErrorKind.NOT_FOUND) {
                    return sendText(exchange, 404, "job root not found\n");
                }
                logger.log(Level.SEVERE, "Failed to collect stats", e);
                return sendText(exchange, 500, "unable to read stats\n");
            }

            JSONObject document = stats.toJson();
            document.put("status", "ok");
            document.put("timestamp_epoch", System.currentTimeMillis() / 1000L);
            document.put("uptime_seconds", (System.currentTimeMillis() - startTime) / 1000L);

            exchange.getResponseHeaders().set("Content-Type", "application/json");
            return send(exchange, 200, document.toString().getBytes(StandardCharsets.UTF_8));
        }
    }

    private class SubmitHandler extends Endpoint {
        SubmitHandler() {
            super("/submit", true);
        }

        @Override
        int serve(HttpExchange exchange, Map<String, String> query)
                throws IOException, QueueException, BadRequestException {
            String uuid = require(query, "uuid");
            String pdf = require(query, "pdf");
            String metadata = require(query, "metadata");
            store.getResolver().validateId(uuid);
            if (!isSafeRelativePath(pdf) || !isSafeRelativePath(metadata)) {
                throw new BadRequestException("invalid path");
            }

            Path pdfSource;
            Path metadataSource;
            try {
                pdfSource = resolveUnderRoot(pdf);
                metadataSource = resolveUnderRoot(metadata);
            } catch (NoSuchFileException e) {
                return sendText(exchange, 404, "file not found\n");
            } catch (SecurityException e) {
                return sendText(exchange, 403, "path outside root\n");
            }

            store.submit(uuid, pdfSource, metadataSource, "1".equals(query.get("priority")));
            return sendText(exchange, 200, "submitted\n");
        }
    }

    private class ClaimHandler extends Endpoint {
        ClaimHandler() {
            super("/claim", true);
        }

        @Override
        int serve(HttpExchange exchange, Map<String, String> query) throws IOException, QueueException {
            Optional<ClaimedJob> claimed = store.claimNext("1".equals(query.get("prefer_priority")));
            if (claimed.isEmpty()) {
                return sendText(exchange, 404, "no jobs\n");
            }
            return sendText(exchange, 200, claimed.get() + "\n");
        }
    }

    private class ReleaseHandler extends Endpoint {
        ReleaseHandler() {
            super("/release", true);
        }

        @Override
        int serve(HttpExchange exchange, Map<String, String> query)
                throws IOException, QueueException, BadRequestException {
            String uuid = require(query, "uuid");
            JobState state = requireState(query, "state");
            store.release(uuid, state);
            return sendText(exchange, 200, "released\n");
        }
    }

    // Shared by /finalize (locked source) and /move (unlocked source)
    private class TransitionHandler extends Endpoint {
        private final boolean finalize;

        TransitionHandler(String path, boolean finalize) {
            super(path, true);
            this.finalize = finalize;
        }

        @Override
        int serve(HttpExchange exchange, Map<String, String> query)
                throws IOException, QueueException, BadRequestException {
            String uuid = require(query, "uuid");
            JobState from = requireState(query, "from");
            JobState to = requireState(query, "to");
            if (finalize) {
                store.finalizeJob(uuid, from, to);
                return sendText(exchange, 200, "finalized\n");
            }
            store.move(uuid, from, to);
            return sendText(exchange, 200, "moved\n");
        }
    }

    private class StatusHandler extends Endpoint {
        StatusHandler() {
            super("/status", true);
        }

        @Override
        int serve(HttpExchange exchange, Map<String, String> query)
                throws IOException, QueueException, BadRequestException {
            Optional<JobStatusInfo> status = store.status(require(query, "uuid"));
            if (status.isEmpty()) {
                return sendText(exchange, 404, "job not found\n");
            }
            return sendText(exchange, 200, status.get() + "\n");
        }
    }

    private class RetrieveHandler extends Endpoint {
        RetrieveHandler() {
            super("/retrieve", true);
        }

        @Override
        int serve(HttpExchange exchange, Map<String, String> query)
                throws IOException, QueueException, BadRequestException {
            String uuid = require(query, "uuid");
            JobState state = requireState(query, "state");
            ArtifactKind kind = ArtifactKind.fromLabel(require(query, "kind"));
            if (kind == null) {
                throw new BadRequestException("invalid kind");
            }

            Path file = store.paths(uuid, state, false).get(kind);
            long size;
            try {
                Path real = file.toRealPath();
                if (!real.startsWith(store.getRoot().toRealPath())) {
                    return sendText(exchange, 403, "path outside root\n");
                }
                size = Files.size(real);
                file = real;
            } catch (NoSuchFileException e) {
                return sendText(exchange, 404, "job not found\n");
            }

            exchange.getResponseHeaders().set("Content-Type", kind.getContentType());
            exchange.sendResponseHeaders(200, size == 0 ? -1 : size);
            try (OutputStream os = exchange.getResponseBody()) {
                Files.copy(file, os);
            }
            return 200;
        }
    }

    private static class BadRequestException extends Exception {
        BadRequestException(String message) {
            super(message);
        }
    }

    private boolean isAuthorized(HttpExchange exchange, Map<String, String> query) {
        if (token == null) {
            return true;
        }
        String presented = null;
        String header = exchange.getRequestHeaders().getFirst("Authorization");
        if (header != null && header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            presented = header.substring(7).trim();
        } else if (query.containsKey("token")) {
            presented = query.get("token");
        }
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8),
                token.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Resolve a client-supplied path against the root, following symlinks.
     *
     * @throws NoSuchFileException if the file does not exist
     * @throws SecurityException if the real path leaves the root
     */
    private Path resolveUnderRoot(String relative) throws IOException {
        Path real = store.getRoot().resolve(relative).toRealPath();
        if (!real.startsWith(store.getRoot().toRealPath())) {
            throw new SecurityException("path outside root");
        }
        return real;
    }

    // Relative, no empty or dot segments, no drive or backslash characters
    static boolean isSafeRelativePath(String value) {
        if (value == null || value.isEmpty() || value.startsWith("/") || value.startsWith("\\")) {
            return false;
        }
        for (String segment : value.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                return false;
            }
            for (int i = 0; i < segment.length(); i++) {
                char ch = segment.charAt(i);
                if (Character.isISOControl(ch) || ch == ':' || ch == '\\') {
                    return false;
                }
            }
        }
        return true;
    }

    private static String require(Map<String, String> query, String name) throws BadRequestException {
        String value = query.get(name);
        if (value == null || value.isEmpty()) {
            throw new BadRequestException("missing parameters");
        }
        return value;
    }

    private static JobState requireState(Map<String, String> query, String name) throws BadRequestException {
        JobState state = JobState.fromLabel(require(query, name));
        if (state == null) {
            throw new BadRequestException("invalid state");
        }
        return state;
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            try {
                params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
                        URLDecoder.decode(value, StandardCharsets.UTF_8));
            } catch (IllegalArgumentException e) {
                logger.fine("Ignoring malformed query parameter: " + pair);
            }
        }
        return params;
    }

    private static int sendQueueError(HttpExchange exchange, QueueException e) throws IOException {
        switch (e.getKind()) {
            case NOT_FOUND:
                logger.fine("Not found: " + e.getMessage());
                return sendText(exchange, 404, "job not found\n");
            case INVALID_ARGUMENT:
                return sendText(exchange, 400, "invalid arguments\n");
            default:
                logger.log(Level.SEVERE, "Queue operation failed", e);
                return sendText(exchange, e.getKind().getHttpStatus(), "io error\n");
        }
    }

    private static int sendText(HttpExchange exchange, int status, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        return send(exchange, status, body.getBytes(StandardCharsets.UTF_8));
    }

    private static int send(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
        return status;
    }
}
