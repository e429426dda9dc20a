package com.questrail.salvo.transport;

import java.net.InetSocketAddress;

/**
 * A listening line-oriented transport.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the listening socket; it returns once the socket is bound.
 * - {@link #stop()} closes the listening socket and every open channel.
 */
public interface LineServerEndpoint
{
    void setListener(LineChannelListener listener);

    /**
     * Bind and begin accepting connections.
     *
     * @return the bound local address (useful when binding to port 0)
     * @throws IllegalStateException if the listener is not set or binding fails
     */
    InetSocketAddress start();

    void stop();
}
