package com.questrail.salvo.transport.tcp.netty;

import com.questrail.salvo.transport.DisconnectReason;
import com.questrail.salvo.transport.LineChannelListener;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.AttributeKey;

import java.time.Duration;
import java.util.Objects;

/**
 * LineChannelHandler
 * -------------------------------------------------------------------------
 * Terminal inbound handler of a Salvo channel. Forwards decoded lines and
 * lifecycle events to the port listener; never interprets line content.
 *
 * <p>Reader-idle events drive the liveness policy: each one is reported as
 * {@code onIdle} until the inbound silence exceeds the liveness timeout, at
 * which point the channel is closed with {@link DisconnectReason#IDLE_TIMEOUT}.</p>
 */
final class LineChannelHandler extends SimpleChannelInboundHandler<String>
{
    private static final AttributeKey<NettyLineChannel> LINE_CHANNEL =
            AttributeKey.valueOf("salvo.lineChannel");

    private final NettyLineChannel lineChannel;
    private final LineChannelListener listener;
    private final long livenessTimeoutNanos;

    private long lastReadNanos;

    LineChannelHandler(NettyLineChannel lineChannel, LineChannelListener listener, Duration livenessTimeout)
    {
        this.lineChannel = Objects.requireNonNull(lineChannel, "lineChannel");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.livenessTimeoutNanos = livenessTimeout.toNanos();
    }

    static NettyLineChannel lineChannelOf(Channel channel)
    {
        return channel.attr(LINE_CHANNEL).get();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception
    {
        ctx.channel().attr(LINE_CHANNEL).set(lineChannel);
        lastReadNanos = System.nanoTime();
        listener.onOpen(lineChannel);
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line)
    {
        lastReadNanos = System.nanoTime();
        listener.onLine(lineChannel, line);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
    {
        if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.READER_IDLE) {
            if (System.nanoTime() - lastReadNanos >= livenessTimeoutNanos) {
                lineChannel.close(DisconnectReason.IDLE_TIMEOUT);
            } else if (lineChannel.isOpen()) {
                listener.onIdle(lineChannel);
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        DisconnectReason reason = lineChannel.settleCloseReason();
        listener.onClose(lineChannel, reason, lineChannel.closeCause());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        if (cause instanceof TooLongFrameException) {
            // The decoder already discarded the offending bytes.
            listener.onFrameError(lineChannel, cause);
            return;
        }
        // Socket failures and anything that escaped the listener end this connection only.
        lineChannel.fail(DisconnectReason.CONNECTION_LOST, cause);
    }
}
