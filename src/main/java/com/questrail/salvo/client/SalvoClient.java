package com.questrail.salvo.client;

import com.questrail.salvo.protocol.codec.SalvoDecodeException;
import com.questrail.salvo.protocol.codec.SalvoMessageDecoder;
import com.questrail.salvo.protocol.codec.SalvoMessageEncoder;
import com.questrail.salvo.protocol.codec.impl.JsonSalvoMessageCodec;
import com.questrail.salvo.protocol.codec.impl.LineFraming;
import com.questrail.salvo.protocol.model.NameRequest;
import com.questrail.salvo.protocol.model.Ping;
import com.questrail.salvo.protocol.model.Pong;
import com.questrail.salvo.protocol.model.SalvoMessage;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * SalvoClient
 * =============================================================================
 * Blocking TCP client for the canonical Salvo protocol.
 *
 * <p>Inbound records are decoded on the Netty event loop and queued; callers
 * take them with {@link #next(Duration)}. Server {@code ping} records are
 * answered automatically unless auto-pong is disabled, in which case they are
 * queued like any other message. Undecodable lines are logged and dropped.</p>
 *
 * <pre>
 *   try (SalvoClient c = SalvoClient.connect(address)) {
 *       c.hello("alice");
 *       SalvoMessage first = c.next(Duration.ofSeconds(5));
 *   }
 * </pre>
 */
public final class SalvoClient implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(SalvoClient.class);

    private final EventLoopGroup group;
    private final Channel channel;
    private final SalvoMessageEncoder encoder;
    private final BlockingQueue<SalvoMessage> inbox;

    private SalvoClient(EventLoopGroup group, Channel channel, SalvoMessageEncoder encoder,
                        BlockingQueue<SalvoMessage> inbox)
    {
        this.group = group;
        this.channel = channel;
        this.encoder = encoder;
        this.inbox = inbox;
    }

    public static SalvoClient connect(InetSocketAddress address)
    {
        return connect(address, true);
    }

    /**
     * @throws IllegalStateException if the connection cannot be established
     */
    public static SalvoClient connect(InetSocketAddress address, boolean autoPong)
    {
        Objects.requireNonNull(address, "address");
        JsonSalvoMessageCodec codec = new JsonSalvoMessageCodec();
        BlockingQueue<SalvoMessage> inbox = new LinkedBlockingQueue<>();
        EventLoopGroup group = new NioEventLoopGroup(1);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline()
                                .addLast(new LineBasedFrameDecoder(LineFraming.DEFAULT_MAX_LINE_LENGTH))
                                .addLast(new StringDecoder(LineFraming.CHARSET))
                                .addLast(new StringEncoder(LineFraming.CHARSET))
                                .addLast(new InboxHandler(codec, codec, inbox, autoPong));
                    }
                });

        ChannelFuture connect = bootstrap.connect(address).awaitUninterruptibly();
        if (!connect.isSuccess()) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            throw new IllegalStateException("Could not connect to " + address, connect.cause());
        }
        return new SalvoClient(group, connect.channel(), codec, inbox);
    }

    /**
     * Send the handshake record.
     */
    public void hello(String name)
    {
        send(new NameRequest(name));
    }

    public void send(SalvoMessage message)
    {
        sendRaw(encoder.encode(message));
    }

    /**
     * Send one line verbatim; the delimiter is appended.
     */
    public void sendRaw(String line)
    {
        channel.writeAndFlush(LineFraming.frame(line)).syncUninterruptibly();
    }

    /**
     * Take the next inbound message.
     *
     * @throws TimeoutException if nothing arrives within {@code timeout}
     */
    public SalvoMessage next(Duration timeout) throws InterruptedException, TimeoutException
    {
        SalvoMessage m = inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (m == null) {
            throw new TimeoutException("No message within " + timeout);
        }
        return m;
    }

    /**
     * Take the next inbound message and require its type.
     */
    public <T extends SalvoMessage> T next(Class<T> type, Duration timeout)
            throws InterruptedException, TimeoutException
    {
        SalvoMessage m = next(timeout);
        if (!type.isInstance(m)) {
            throw new IllegalStateException("Expected " + type.getSimpleName() + " but received " + m);
        }
        return type.cast(m);
    }

    /**
     * Whether nothing is queued and nothing arrives within {@code quietPeriod}.
     * A message that does arrive is consumed.
     */
    public boolean isQuiet(Duration quietPeriod) throws InterruptedException
    {
        SalvoMessage m = inbox.poll(quietPeriod.toMillis(), TimeUnit.MILLISECONDS);
        if (m != null) {
            log.debug("Unexpected message while waiting for quiet: {}", m);
            return false;
        }
        return true;
    }

    public boolean isConnected()
    {
        return channel.isActive();
    }

    /**
     * Wait for the server to close the connection.
     */
    public boolean awaitClosed(Duration timeout)
    {
        return channel.closeFuture().awaitUninterruptibly(timeout.toMillis());
    }

    @Override
    public void close()
    {
        channel.close().awaitUninterruptibly();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    private static final class InboxHandler extends SimpleChannelInboundHandler<String>
    {
        private final SalvoMessageDecoder decoder;
        private final SalvoMessageEncoder encoder;
        private final BlockingQueue<SalvoMessage> inbox;
        private final boolean autoPong;

        InboxHandler(SalvoMessageDecoder decoder, SalvoMessageEncoder encoder,
                     BlockingQueue<SalvoMessage> inbox, boolean autoPong)
        {
            this.decoder = decoder;
            this.encoder = encoder;
            this.inbox = inbox;
            this.autoPong = autoPong;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            SalvoMessage m;
            try {
                m = decoder.decode(line);
            } catch (SalvoDecodeException e) {
                log.warn("Dropping undecodable line from server: {}", e.getMessage());
                return;
            }
            if (autoPong && m instanceof Ping) {
                ctx.writeAndFlush(LineFraming.frame(encoder.encode(new Pong())));
                return;
            }
            inbox.add(m);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Client connection failed", cause);
            ctx.close();
        }
    }
}
