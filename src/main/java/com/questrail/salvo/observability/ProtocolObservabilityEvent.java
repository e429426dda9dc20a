package com.questrail.salvo.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * A protocol anomaly that was handled in place.
 *
 * @param source player name or connection id the anomaly is attributed to
 */
public record ProtocolObservabilityEvent(
    Instant timestamp,
    Kind kind,
    String source,
    String detail
) {
    public enum Kind {
        HANDSHAKE_REJECTED,
        NAME_TAKEN,
        MALFORMED_MESSAGE,
        UNKNOWN_MESSAGE_TYPE,
        OUT_OF_TURN,
        REJECTED_BY_SESSION,
        SESSION_NOT_FOUND
    }

    public ProtocolObservabilityEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(detail, "detail");
    }
}
