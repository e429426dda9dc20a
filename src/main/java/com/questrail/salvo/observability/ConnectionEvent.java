package com.questrail.salvo.observability;

import com.questrail.salvo.transport.DisconnectReason;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * Connection opened or closed.
 *
 * @param reason {@code null} for {@link Kind#OPENED}
 */
public record ConnectionEvent(
    Instant timestamp,
    Kind kind,
    String connectionId,
    SocketAddress remoteAddress,
    DisconnectReason reason
) {
    public enum Kind { OPENED, CLOSED }

    public ConnectionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(connectionId, "connectionId");
    }
}
