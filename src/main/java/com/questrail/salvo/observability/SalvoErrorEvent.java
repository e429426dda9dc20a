package com.questrail.salvo.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the Salvo server.
 */
public record SalvoErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
