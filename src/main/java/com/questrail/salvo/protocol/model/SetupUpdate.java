package com.questrail.salvo.protocol.model;

/**
 * Broadcast whenever a player reports {@link SetupComplete}.
 */
public record SetupUpdate(int player, boolean ready) implements SalvoMessage {
    @Override
    public MessageType type() {
        return MessageType.SETUP_UPDATE;
    }
}
