package com.questrail.salvo.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * ServerConfigLoader
 * -----------------------------------------------------------------------------
 * Builds a {@link ServerConfig} from {@code salvo.*} properties.
 *
 * <p>Sources, later overriding earlier:</p>
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code salvo.properties} on the classpath, if present</li>
 *   <li>{@code salvo.*} JVM system properties</li>
 * </ol>
 */
public final class ServerConfigLoader
{
    private static final Logger log = LoggerFactory.getLogger(ServerConfigLoader.class);

    public static final String RESOURCE = "salvo.properties";

    static final String HOST = "salvo.host";
    static final String PORT = "salvo.port";
    static final String LEGACY_PORT = "salvo.legacyPort";
    static final String MAX_LINE_LENGTH = "salvo.maxLineLength";
    static final String MAX_PENDING_WRITES = "salvo.maxPendingWrites";
    static final String HEARTBEAT_INTERVAL_MILLIS = "salvo.heartbeatIntervalMillis";
    static final String LIVENESS_TIMEOUT_MILLIS = "salvo.livenessTimeoutMillis";
    static final String WORKER_THREADS = "salvo.workerThreads";

    private ServerConfigLoader() {
    }

    /**
     * Load from the classpath resource and system properties.
     *
     * @throws IllegalArgumentException if a value is not a number or fails validation
     */
    public static ServerConfig load()
    {
        Properties merged = new Properties();
        ClassLoader cl = ServerConfigLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                merged.load(in);
                log.debug("Loaded {} from classpath", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }

        Properties system = System.getProperties();
        for (String key : system.stringPropertyNames()) {
            if (key.startsWith("salvo.")) {
                merged.setProperty(key, system.getProperty(key));
            }
        }
        return fromProperties(merged);
    }

    /**
     * Build a configuration from explicit properties; absent keys keep their defaults.
     */
    public static ServerConfig fromProperties(Properties props)
    {
        Objects.requireNonNull(props, "props");
        ServerConfig.Builder b = ServerConfig.builder();

        String host = props.getProperty(HOST);
        if (host != null && !host.isBlank()) {
            b.withHost(host.trim());
        }
        Integer port = intValue(props, PORT);
        if (port != null) {
            b.withPort(port);
        }
        Integer legacyPort = intValue(props, LEGACY_PORT);
        if (legacyPort != null) {
            b.withLegacyPort(legacyPort);
        }
        Integer maxLine = intValue(props, MAX_LINE_LENGTH);
        if (maxLine != null) {
            b.withMaxLineLength(maxLine);
        }
        Integer maxPending = intValue(props, MAX_PENDING_WRITES);
        if (maxPending != null) {
            b.withMaxPendingWrites(maxPending);
        }
        Integer heartbeat = intValue(props, HEARTBEAT_INTERVAL_MILLIS);
        if (heartbeat != null) {
            b.withHeartbeatInterval(Duration.ofMillis(heartbeat));
        }
        Integer liveness = intValue(props, LIVENESS_TIMEOUT_MILLIS);
        if (liveness != null) {
            b.withLivenessTimeout(Duration.ofMillis(liveness));
        }
        Integer workers = intValue(props, WORKER_THREADS);
        if (workers != null) {
            b.withWorkerThreads(workers);
        }
        return b.build();
    }

    private static Integer intValue(Properties props, String key)
    {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: '" + raw + "'", e);
        }
    }
}
