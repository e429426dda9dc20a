package com.questrail.salvo.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the Salvo server runtime.
 *
 * @param host                 interface to bind; {@code null} or blank binds all interfaces
 * @param port                 canonical JSON protocol port; 0 picks an ephemeral port
 * @param legacyPort           pipe-protocol port; negative disables the legacy room
 * @param maxLineLength        longest accepted inbound record, in bytes
 * @param maxPendingWrites     unflushed outbound records tolerated per connection
 * @param heartbeatInterval    inbound silence before the server pings; zero disables heartbeats
 * @param livenessTimeout      inbound silence before the connection is dropped
 * @param workerThreads        Netty worker threads; zero selects Netty's default
 */
public record ServerConfig(
    String host,
    int port,
    int legacyPort,
    int maxLineLength,
    int maxPendingWrites,
    Duration heartbeatInterval,
    Duration livenessTimeout,
    int workerThreads
) {
    public static final int DEFAULT_PORT = 5000;
    public static final int LEGACY_DISABLED = -1;
    public static final int DEFAULT_MAX_LINE_LENGTH = 8192;
    public static final int DEFAULT_MAX_PENDING_WRITES = 1024;
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(15);
    public static final Duration DEFAULT_LIVENESS_TIMEOUT = Duration.ofSeconds(45);

    public ServerConfig {
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(livenessTimeout, "livenessTimeout");
        requirePort("port", port);
        if (legacyPort >= 0) {
            requirePort("legacyPort", legacyPort);
            if (legacyPort != 0 && legacyPort == port) {
                throw new IllegalArgumentException("legacyPort must differ from port");
            }
        }
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        if (maxPendingWrites <= 0) {
            throw new IllegalArgumentException("maxPendingWrites must be positive: " + maxPendingWrites);
        }
        if (heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must not be negative");
        }
        if (livenessTimeout.isNegative()) {
            throw new IllegalArgumentException("livenessTimeout must not be negative");
        }
        if (!heartbeatInterval.isZero() && livenessTimeout.compareTo(heartbeatInterval) < 0) {
            throw new IllegalArgumentException("livenessTimeout must not be shorter than heartbeatInterval");
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("workerThreads must not be negative: " + workerThreads);
        }
    }

    public static ServerConfig defaults() {
        return builder().build();
    }

    public boolean legacyEnabled() {
        return legacyPort >= 0;
    }

    private static void requirePort(String name, int value) {
        if (value < 0 || value > 65535) {
            throw new IllegalArgumentException(name + " out of range: " + value);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_PORT;
        private int legacyPort = LEGACY_DISABLED;
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;
        private int maxPendingWrites = DEFAULT_MAX_PENDING_WRITES;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration livenessTimeout = DEFAULT_LIVENESS_TIMEOUT;
        private int workerThreads;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withLegacyPort(int legacyPort) {
            this.legacyPort = legacyPort;
            return this;
        }

        public Builder withMaxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder withMaxPendingWrites(int maxPendingWrites) {
            this.maxPendingWrites = maxPendingWrites;
            return this;
        }

        public Builder withHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder withLivenessTimeout(Duration livenessTimeout) {
            this.livenessTimeout = livenessTimeout;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(host, port, legacyPort, maxLineLength, maxPendingWrites,
                    heartbeatInterval, livenessTimeout, workerThreads);
        }
    }
}
