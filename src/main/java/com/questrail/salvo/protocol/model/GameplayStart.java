package com.questrail.salvo.protocol.model;

/**
 * Broadcast exactly once per session, when both players have completed setup.
 */
public record GameplayStart(int currentPlayer) implements SalvoMessage {
    @Override
    public MessageType type() {
        return MessageType.GAMEPLAY_START;
    }
}
