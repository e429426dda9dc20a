package com.questrail.salvo.protocol.model;

/**
 * Broadcast after a missed shot passes the turn.
 */
public record TurnChange(int currentPlayer) implements SalvoMessage {
    @Override
    public MessageType type() {
        return MessageType.TURN_CHANGE;
    }
}
