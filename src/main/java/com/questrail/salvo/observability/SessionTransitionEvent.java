package com.questrail.salvo.observability;

import com.questrail.salvo.session.state.SessionPhase;

import java.time.Instant;
import java.util.Objects;

/**
 * A game session moved from one phase to another.
 *
 * @param trigger short description of what caused the transition
 */
public record SessionTransitionEvent(
    Instant timestamp,
    int sessionId,
    SessionPhase from,
    SessionPhase to,
    String trigger
) {
    public SessionTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(trigger, "trigger");
    }
}
