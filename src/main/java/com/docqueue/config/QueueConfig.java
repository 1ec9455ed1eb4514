package com.docqueue.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings of a queue process.
 *
 * <p>Values are layered, later sources winning:</p>
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code docqueue.properties} on the classpath</li>
 *   <li>system properties with the same keys</li>
 *   <li>environment variables {@code DOCQUEUE_ROOT}, {@code DOCQUEUE_PORT},
 *       {@code DOCQUEUE_BIND} and {@code JOB_QUEUE_TOKEN}</li>
 * </ol>
 * <p>Command-line flags override all of them; see {@code Main}.</p>
 */
public class QueueConfig {
    private static final Logger logger = Logger.getLogger(QueueConfig.class.getName());

    public static final String RESOURCE = "docqueue.properties";

    public static final String ROOT = "docqueue.root";
    public static final String HTTP_PORT = "docqueue.http.port";
    public static final String HTTP_BIND = "docqueue.http.bind";
    public static final String HTTP_TOKEN = "docqueue.http.token";
    public static final String HTTP_THREADS = "docqueue.http.threads";
    public static final String WORKERS = "docqueue.workers";
    public static final String POLL_INTERVAL_MS = "docqueue.poll-interval-ms";
    public static final String MAX_PATH_LENGTH = "docqueue.max-path-length";

    private static final Map<String, String> ENVIRONMENT_KEYS = Map.of(
            "DOCQUEUE_ROOT", ROOT,
            "DOCQUEUE_PORT", HTTP_PORT,
            "DOCQUEUE_BIND", HTTP_BIND,
            "JOB_QUEUE_TOKEN", HTTP_TOKEN);

    private final Path root;
    private final int httpPort;
    private final String httpBind;
    private final String httpToken;
    private final int httpThreads;
    private final int workers;
    private final long pollIntervalMillis;
    private final int maxPathLength;

    /**
     * Build a configuration from explicit properties, defaults filling the gaps.
     *
     * @param properties the settings
     * @throws IllegalArgumentException if a numeric setting is malformed or out of range
     */
    public QueueConfig(Properties properties) {
        this.root = Paths.get(properties.getProperty(ROOT, "./queue"));
        this.httpPort = intValue(properties, HTTP_PORT, 8080, 0, 65535);
        this.httpBind = properties.getProperty(HTTP_BIND, "127.0.0.1");
        String token = properties.getProperty(HTTP_TOKEN, "");
        this.httpToken = token.isBlank() ? null : token.trim();
        this.httpThreads = intValue(properties, HTTP_THREADS, 4, 1, 1024);
        this.workers = intValue(properties, WORKERS, 4, 1, 1024);
        this.pollIntervalMillis = intValue(properties, POLL_INTERVAL_MS, 1000, 0, Integer.MAX_VALUE);
        this.maxPathLength = intValue(properties, MAX_PATH_LENGTH, 4096, 1, Integer.MAX_VALUE);
    }

    /**
     * Load the layered configuration of this process.
     *
     * @return the configuration
     * @throws IllegalArgumentException if a numeric setting is malformed
     */
    public static QueueConfig load() {
        return load(System.getProperties(), System.getenv());
    }

    static QueueConfig load(Properties systemProperties, Map<String, String> environment) {
        Properties merged = new Properties();
        try (InputStream in = QueueConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                merged.load(in);
                logger.fine("Loaded " + RESOURCE + " from classpath");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }

        for (String key : systemProperties.stringPropertyNames()) {
            if (key.startsWith("docqueue.")) {
                merged.setProperty(key, systemProperties.getProperty(key));
            }
        }

        Map<String, String> applied = new HashMap<>();
        for (Map.Entry<String, String> entry : ENVIRONMENT_KEYS.entrySet()) {
            String value = environment.get(entry.getKey());
            if (value != null && !value.isEmpty()) {
                merged.setProperty(entry.getValue(), value);
                applied.put(entry.getKey(), entry.getValue());
            }
        }
        if (!applied.isEmpty()) {
            logger.fine("Environment overrides: " + applied.keySet());
        }
        return new QueueConfig(merged);
    }

    private static int intValue(Properties properties, String key, int defaultValue, int min, int max) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + raw + "'", e);
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException(key + " must be between " + min + " and " + max + ": " + value);
        }
        return value;
    }

    public Path getRoot() {
        return root;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public String getHttpBind() {
        return httpBind;
    }

    /**
     * @return the bearer token, or null when the control plane runs unauthenticated
     */
    public String getHttpToken() {
        return httpToken;
    }

    public int getHttpThreads() {
        return httpThreads;
    }

    public int getWorkers() {
        return workers;
    }

    public long getPollIntervalMillis() {
        return pollIntervalMillis;
    }

    public int getMaxPathLength() {
        return maxPathLength;
    }

    @Override
    public String toString() {
        return "QueueConfig{root=" + root + ", http=" + httpBind + ":" + httpPort
                + ", auth=" + (httpToken != null) + ", workers=" + workers
                + ", pollIntervalMillis=" + pollIntervalMillis + "}";
    }
}
