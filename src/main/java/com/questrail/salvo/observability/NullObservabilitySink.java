package com.questrail.salvo.observability;

/**
 * No-op implementation of SalvoObservabilitySink.
 */
public final class NullObservabilitySink implements SalvoObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {}

    @Override
    public void onProtocolEvent(ProtocolObservabilityEvent event) {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onError(SalvoErrorEvent event) {}
}
