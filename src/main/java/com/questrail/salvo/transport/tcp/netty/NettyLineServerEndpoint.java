package com.questrail.salvo.transport.tcp.netty;

import com.questrail.salvo.protocol.codec.impl.LineFraming;
import com.questrail.salvo.transport.DisconnectReason;
import com.questrail.salvo.transport.LineChannelListener;
import com.questrail.salvo.transport.LineServerEndpoint;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.GlobalEventExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyLineServerEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link LineServerEndpoint} port over TCP.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode message records</li>
 *   <li>Interpret protocol semantics</li>
 *   <li>Originate protocol messages</li>
 * </ul>
 *
 * <h2>Pipeline per channel</h2>
 * <pre>
 *   IdleStateHandler → LineBasedFrameDecoder → StringDecoder(UTF-8)
 *                    → StringEncoder(UTF-8) → {@link LineChannelHandler}
 * </pre>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the TCP socket and begins accepting connections.
 * - {@link #stop()} closes every open channel, the listening channel, and shuts
 *   down both event loop groups.
 */
public final class NettyLineServerEndpoint implements LineServerEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyLineServerEndpoint.class);

    /**
     * Transport options.
     *
     * @param bindAddress       local address to listen on
     * @param maxLineLength     longest accepted inbound record, in bytes
     * @param maxPendingWrites  unflushed outbound records tolerated before the channel is torn down
     * @param heartbeatInterval inbound silence after which {@code onIdle} fires; zero disables idle detection
     * @param livenessTimeout   inbound silence after which the channel is closed; must not be shorter than the heartbeat interval
     * @param workerThreads     worker event loop threads; zero selects Netty's default
     */
    public record Options(
            InetSocketAddress bindAddress,
            int maxLineLength,
            int maxPendingWrites,
            Duration heartbeatInterval,
            Duration livenessTimeout,
            int workerThreads
    ) {
        public Options {
            Objects.requireNonNull(bindAddress, "bindAddress");
            Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
            Objects.requireNonNull(livenessTimeout, "livenessTimeout");
            if (maxLineLength <= 0) {
                throw new IllegalArgumentException("maxLineLength must be positive");
            }
            if (maxPendingWrites <= 0) {
                throw new IllegalArgumentException("maxPendingWrites must be positive");
            }
            if (heartbeatInterval.isNegative() || livenessTimeout.isNegative()) {
                throw new IllegalArgumentException("heartbeat and liveness durations must be non-negative");
            }
            if (!heartbeatInterval.isZero() && livenessTimeout.compareTo(heartbeatInterval) < 0) {
                throw new IllegalArgumentException("livenessTimeout must not be shorter than heartbeatInterval");
            }
            if (workerThreads < 0) {
                throw new IllegalArgumentException("workerThreads must be non-negative");
            }
        }
    }

    private final String name;
    private final Options options;
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private volatile LineChannelListener listener;
    private volatile EventLoopGroup bossGroup;
    private volatile EventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    /**
     * @param name    short label used in thread-independent log lines (e.g. "salvo", "legacy")
     * @param options transport options
     */
    public NettyLineServerEndpoint(String name, Options options)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public void setListener(LineChannelListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized InetSocketAddress start()
    {
        LineChannelListener l = requireListener();
        if (serverChannel != null) {
            throw new IllegalStateException("Endpoint '" + name + "' already started");
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(options.workerThreads());

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (!options.heartbeatInterval().isZero()) {
                            p.addLast(new IdleStateHandler(
                                    options.heartbeatInterval().toMillis(), 0, 0, TimeUnit.MILLISECONDS));
                        }
                        // failFast=false: an over-long line is discarded up to the next
                        // delimiter and reported; the stream stays aligned.
                        p.addLast(new LineBasedFrameDecoder(options.maxLineLength(), true, false));
                        p.addLast(new StringDecoder(LineFraming.CHARSET));
                        p.addLast(new StringEncoder(LineFraming.CHARSET));
                        p.addLast(new LineChannelHandler(
                                new NettyLineChannel(ch, options.maxPendingWrites()),
                                l,
                                options.livenessTimeout()));
                        channels.add(ch);
                    }
                });

        ChannelFuture bind = bootstrap.bind(options.bindAddress()).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            shutdownGroups();
            throw new IllegalStateException("Endpoint '" + name + "' failed to bind " + options.bindAddress(), bind.cause());
        }
        serverChannel = bind.channel();
        InetSocketAddress local = (InetSocketAddress) serverChannel.localAddress();
        log.info("Endpoint '{}' listening on {}", name, local);
        return local;
    }

    @Override
    public synchronized void stop()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            return;
        }
        serverChannel = null;

        ch.close().awaitUninterruptibly();
        for (Channel child : channels) {
            NettyLineChannel lineChannel = LineChannelHandler.lineChannelOf(child);
            if (lineChannel != null) {
                lineChannel.close(DisconnectReason.SERVER_SHUTDOWN);
            } else {
                child.close();
            }
        }
        channels.close().awaitUninterruptibly();
        shutdownGroups();
        log.info("Endpoint '{}' stopped", name);
    }

    /**
     * Bound address, or {@code null} if the endpoint is not running.
     */
    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        return ch == null ? null : (InetSocketAddress) ch.localAddress();
    }

    private void shutdownGroups()
    {
        EventLoopGroup boss = bossGroup;
        EventLoopGroup workers = workerGroup;
        if (boss != null) {
            boss.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        }
        if (workers != null) {
            workers.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        }
        bossGroup = null;
        workerGroup = null;
    }

    private LineChannelListener requireListener()
    {
        LineChannelListener l = listener;
        if (l == null) {
            throw new IllegalStateException("LineChannelListener must be set before start()");
        }
        return l;
    }
}
