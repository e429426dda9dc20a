package com.questrail.salvo.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SalvoObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSalvoObservabilitySink implements SalvoObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSalvoObservabilitySink.class);

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        log.info("Session {}: {} -> {} ({})",
            event.sessionId(),
            event.from(),
            event.to(),
            event.trigger());
    }

    @Override
    public void onProtocolEvent(ProtocolObservabilityEvent event) {
        switch (event.kind()) {
            case OUT_OF_TURN, REJECTED_BY_SESSION ->
                log.debug("Protocol {} from {}: {}", event.kind(), event.source(), event.detail());
            default ->
                log.warn("Protocol {} from {}: {}", event.kind(), event.source(), event.detail());
        }
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        if (event.kind() == ConnectionEvent.Kind.OPENED) {
            log.info("Connection {} opened from {}", event.connectionId(), event.remoteAddress());
        } else {
            log.info("Connection {} closed ({})", event.connectionId(), event.reason());
        }
    }

    @Override
    public void onError(SalvoErrorEvent event) {
        log.error("Salvo error: {}", event.message(), event.cause());
    }
}
