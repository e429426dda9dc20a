package com.questrail.salvo.transport;

import java.net.SocketAddress;

/**
 * LineChannel
 * -----------------------------------------------------------------------------
 * One accepted connection of a line-oriented transport.
 *
 * <p>Lines handed to {@link #sendLine(String)} are records without a delimiter;
 * the implementation frames them and transmits them in call order. Sending
 * never blocks the caller. Implementations bound the number of unflushed lines
 * and close the channel with {@link DisconnectReason#BACKPRESSURE} when the
 * bound is exceeded.</p>
 */
public interface LineChannel
{
    /**
     * Stable identifier of this connection, unique while the endpoint runs.
     */
    String id();

    SocketAddress remoteAddress();

    /**
     * Enqueue one record for transmission. Ignored once the channel is closed.
     */
    void sendLine(String record);

    /**
     * Close the connection. Idempotent; the first reason wins.
     */
    void close(DisconnectReason reason);

    boolean isOpen();
}
