package com.questrail.salvo.protocol.model;

/** Reply to {@link Ping}. */
public record Pong() implements SalvoMessage {
    @Override
    public MessageType type() {
        return MessageType.PONG;
    }
}
