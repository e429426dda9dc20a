package com.questrail.salvo.transport;

/**
 * Why a connection ended.
 */
public enum DisconnectReason {
    /** The peer closed its side of the stream. */
    REMOTE_CLOSED,

    /** A read or write failed. */
    CONNECTION_LOST,

    /** No inbound traffic within the liveness window. */
    IDLE_TIMEOUT,

    /** The outbound queue exceeded its bound; the peer is not consuming. */
    BACKPRESSURE,

    /** The first message was not an acceptable handshake. */
    HANDSHAKE_REJECTED,

    /** The server is shutting down. */
    SERVER_SHUTDOWN
}
