package com.questrail.salvo.transport.tcp.netty;

import com.questrail.salvo.protocol.codec.impl.LineFraming;
import com.questrail.salvo.transport.DisconnectReason;
import com.questrail.salvo.transport.LineChannel;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link LineChannel} over a Netty {@link Channel}.
 *
 * <p>Writes are handed to the channel's event loop and complete asynchronously.
 * The number of records written but not yet flushed to the socket is bounded;
 * exceeding the bound closes the channel with {@link DisconnectReason#BACKPRESSURE}.</p>
 */
final class NettyLineChannel implements LineChannel
{
    private final Channel channel;
    private final int maxPendingWrites;
    private final AtomicInteger pendingWrites = new AtomicInteger();
    private final AtomicReference<DisconnectReason> closeReason = new AtomicReference<>();
    private final AtomicReference<Throwable> closeCause = new AtomicReference<>();

    NettyLineChannel(Channel channel, int maxPendingWrites)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.maxPendingWrites = maxPendingWrites;
    }

    @Override
    public String id()
    {
        return channel.id().asShortText();
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    @Override
    public void sendLine(String record)
    {
        Objects.requireNonNull(record, "record");
        if (!isOpen()) {
            return;
        }
        if (pendingWrites.incrementAndGet() > maxPendingWrites) {
            pendingWrites.decrementAndGet();
            close(DisconnectReason.BACKPRESSURE);
            return;
        }
        channel.writeAndFlush(LineFraming.frame(record)).addListener((ChannelFutureListener) future -> {
            pendingWrites.decrementAndGet();
            if (!future.isSuccess()) {
                fail(DisconnectReason.CONNECTION_LOST, future.cause());
            }
        });
    }

    @Override
    public void close(DisconnectReason reason)
    {
        Objects.requireNonNull(reason, "reason");
        closeReason.compareAndSet(null, reason);
        channel.close();
    }

    void fail(DisconnectReason reason, Throwable cause)
    {
        if (closeReason.compareAndSet(null, reason)) {
            closeCause.set(cause);
        }
        channel.close();
    }

    @Override
    public boolean isOpen()
    {
        return closeReason.get() == null && channel.isActive();
    }

    /**
     * The reason recorded by the first close, or {@link DisconnectReason#REMOTE_CLOSED}
     * if the channel went inactive without a local close.
     */
    DisconnectReason settleCloseReason()
    {
        closeReason.compareAndSet(null, DisconnectReason.REMOTE_CLOSED);
        return closeReason.get();
    }

    Throwable closeCause()
    {
        return closeCause.get();
    }

    int pendingWrites()
    {
        return pendingWrites.get();
    }

    @Override
    public String toString()
    {
        return "NettyLineChannel[" + id() + " " + remoteAddress() + "]";
    }
}
