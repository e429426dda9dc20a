package com.questrail.salvo.transport;

/**
 * Receives connection lifecycle and inbound lines from a {@link LineServerEndpoint}.
 *
 * <p>For a given channel, callbacks are delivered sequentially and in order:
 * {@code onOpen}, then any number of {@code onLine}/{@code onIdle}/{@code onFrameError},
 * then exactly one {@code onClose}.</p>
 */
public interface LineChannelListener
{
    void onOpen(LineChannel channel);

    /**
     * One complete inbound record, delimiter removed.
     */
    void onLine(LineChannel channel, String line);

    /**
     * No inbound traffic for one heartbeat interval; the channel is still open.
     */
    void onIdle(LineChannel channel);

    /**
     * A frame was discarded by the transport (e.g. it exceeded the maximum line length).
     * The channel stays open.
     */
    void onFrameError(LineChannel channel, Throwable cause);

    /**
     * The channel is closed. Delivered exactly once per channel.
     *
     * @param cause the underlying failure, or {@code null}
     */
    void onClose(LineChannel channel, DisconnectReason reason, Throwable cause);
}
