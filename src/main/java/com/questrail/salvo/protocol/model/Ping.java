package com.questrail.salvo.protocol.model;

/** Liveness probe. */
public record Ping() implements SalvoMessage {
    @Override
    public MessageType type() {
        return MessageType.PING;
    }
}
