package com.questrail.salvo.transport;

import com.questrail.salvo.protocol.codec.SalvoMessageEncoder;
import com.questrail.salvo.protocol.model.SalvoMessage;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ConnectionHandle
 * =============================================================================
 * Message-level view of one client connection.
 *
 * <h2>Outbound</h2>
 * {@link #send(SalvoMessage)} encodes the message and hands the record to the
 * underlying {@link LineChannel}, which transmits records in call order and
 * never blocks. A slow consumer is torn down by the channel's bounded queue.
 *
 * <h2>Inbound</h2>
 * Inbound records are pushed by the transport to its {@link LineChannelListener}
 * one at a time, in arrival order. End-of-stream, a socket error and an
 * explicit close all surface as a single {@code onClose} callback.
 *
 * <h2>Thread Safety</h2>
 * All methods may be called from any thread. {@link #close(DisconnectReason)}
 * is idempotent: the channel is closed at most once.
 */
public final class ConnectionHandle
{
    private final LineChannel channel;
    private final SalvoMessageEncoder encoder;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ConnectionHandle(LineChannel channel, SalvoMessageEncoder encoder)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
    }

    public String id()
    {
        return channel.id();
    }

    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    /**
     * Enqueue a message for ordered transmission.
     *
     * @return {@code false} if the handle is already closed and the message was dropped
     */
    public boolean send(SalvoMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (!isOpen()) {
            return false;
        }
        channel.sendLine(encoder.encode(message));
        return true;
    }

    /**
     * Close the connection. Only the first call has an effect.
     */
    public void close(DisconnectReason reason)
    {
        Objects.requireNonNull(reason, "reason");
        if (closed.compareAndSet(false, true)) {
            channel.close(reason);
        }
    }

    public boolean isOpen()
    {
        return !closed.get() && channel.isOpen();
    }

    @Override
    public String toString()
    {
        return "ConnectionHandle[" + channel.id() + " " + channel.remoteAddress() + "]";
    }
}
