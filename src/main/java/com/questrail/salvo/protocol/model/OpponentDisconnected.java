package com.questrail.salvo.protocol.model;

/**
 * Sent once to the surviving player when the opponent's connection is lost.
 */
public record OpponentDisconnected() implements SalvoMessage {
    @Override
    public MessageType type() {
        return MessageType.OPPONENT_DISCONNECTED;
    }
}
