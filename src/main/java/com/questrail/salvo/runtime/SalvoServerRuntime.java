package com.questrail.salvo.runtime;

import com.questrail.salvo.config.ServerConfig;
import com.questrail.salvo.observability.NullObservabilitySink;
import com.questrail.salvo.observability.SalvoObservabilitySink;
import com.questrail.salvo.protocol.codec.impl.JsonSalvoMessageCodec;
import com.questrail.salvo.protocol.legacy.LegacyRoom;
import com.questrail.salvo.server.SalvoServer;
import com.questrail.salvo.transport.LineServerEndpoint;
import com.questrail.salvo.transport.tcp.netty.NettyLineServerEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Objects;
import java.util.Random;

/**
 * SalvoServerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a running Salvo server: the server
 * aggregate, its TCP endpoint, and the optional legacy room endpoint.
 */
public final class SalvoServerRuntime {
    private static final Logger log = LoggerFactory.getLogger(SalvoServerRuntime.class);

    private final ServerConfig config;
    private final SalvoServer server;
    private final LineServerEndpoint endpoint;
    private final LegacyRoom legacyRoom;
    private final LineServerEndpoint legacyEndpoint;

    private volatile InetSocketAddress localAddress;
    private volatile InetSocketAddress legacyAddress;

    private SalvoServerRuntime(
            ServerConfig config,
            SalvoServer server,
            LineServerEndpoint endpoint,
            LegacyRoom legacyRoom,
            LineServerEndpoint legacyEndpoint) {
        this.config = config;
        this.server = server;
        this.endpoint = endpoint;
        this.legacyRoom = legacyRoom;
        this.legacyEndpoint = legacyEndpoint;
    }

    public synchronized void start() {
        localAddress = endpoint.start();
        if (legacyEndpoint != null) {
            try {
                legacyAddress = legacyEndpoint.start();
            } catch (RuntimeException e) {
                endpoint.stop();
                throw e;
            }
        }
        log.info("Salvo server started on {}{}", localAddress,
                legacyAddress == null ? "" : " (legacy room on " + legacyAddress + ")");
    }

    /**
     * Ends every session silently, closes every connection, and releases the
     * listening sockets.
     */
    public synchronized void stop() {
        server.shutdown();
        endpoint.stop();
        if (legacyEndpoint != null) {
            legacyEndpoint.stop();
        }
        log.info("Salvo server stopped");
    }

    public ServerConfig config() {
        return config;
    }

    public SalvoServer server() {
        return server;
    }

    /**
     * Bound address of the JSON endpoint, or {@code null} before {@link #start()}.
     */
    public InetSocketAddress localAddress() {
        return localAddress;
    }

    /**
     * Bound address of the legacy endpoint, or {@code null} if disabled or not started.
     */
    public InetSocketAddress legacyAddress() {
        return legacyAddress;
    }

    /**
     * The legacy room, or {@code null} if disabled.
     */
    public LegacyRoom legacyRoom() {
        return legacyRoom;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ServerConfig config = ServerConfig.defaults();
        private SalvoObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Clock clock = Clock.systemUTC();
        private Random legacyRandom = new Random();

        public Builder withConfig(ServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(SalvoObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withLegacyRandom(Random random) {
            this.legacyRandom = random;
            return this;
        }

        public SalvoServerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(legacyRandom, "legacyRandom");

            // 1. Codec and server aggregate
            JsonSalvoMessageCodec codec = new JsonSalvoMessageCodec();
            SalvoServer server = new SalvoServer(codec, codec, observabilitySink, clock);

            // 2. Canonical endpoint
            LineServerEndpoint endpoint = new NettyLineServerEndpoint("salvo", options(config, config.port()));
            endpoint.setListener(server);

            // 3. Optional legacy room
            LegacyRoom room = null;
            LineServerEndpoint legacyEndpoint = null;
            if (config.legacyEnabled()) {
                room = new LegacyRoom(legacyRandom);
                legacyEndpoint = new NettyLineServerEndpoint("legacy", options(config, config.legacyPort()));
                legacyEndpoint.setListener(room);
            }

            return new SalvoServerRuntime(config, server, endpoint, room, legacyEndpoint);
        }

        private static NettyLineServerEndpoint.Options options(ServerConfig config, int port) {
            InetSocketAddress bind = config.host() == null || config.host().isBlank()
                    ? new InetSocketAddress(port)
                    : new InetSocketAddress(config.host(), port);
            return new NettyLineServerEndpoint.Options(
                    bind,
                    config.maxLineLength(),
                    config.maxPendingWrites(),
                    config.heartbeatInterval(),
                    config.livenessTimeout(),
                    config.workerThreads());
        }
    }
}
