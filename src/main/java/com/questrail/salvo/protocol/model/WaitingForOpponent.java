package com.questrail.salvo.protocol.model;

/**
 * Sent to a registered player that has been placed in the matchmaking queue.
 */
public record WaitingForOpponent() implements SalvoMessage {
    @Override
    public MessageType type() {
        return MessageType.WAITING_FOR_OPPONENT;
    }
}
