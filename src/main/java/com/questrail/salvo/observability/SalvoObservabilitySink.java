package com.questrail.salvo.observability;

/**
 * Main interface for receiving Salvo server observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface SalvoObservabilitySink {
    /**
     * Called when a game session changes phase.
     * @param event the transition event details
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called when a protocol-level anomaly is handled without faulting the
     * connection (e.g., out-of-turn shot, malformed frame, unknown type).
     * @param event the protocol event
     */
    void onProtocolEvent(ProtocolObservabilityEvent event);

    /**
     * Called when a connection opens or closes.
     * @param event the connection event
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called when an error or anomaly occurs in the server.
     * @param event the error event
     */
    void onError(SalvoErrorEvent event);
}
