package com.questrail.salvo.protocol.model;

/**
 * Explicit end-of-game signal reported by a client, broadcast to both players.
 *
 * @param winner slot of the winning player
 */
public record GameOver(int winner) implements SalvoMessage {
    @Override
    public MessageType type() {
        return MessageType.GAME_OVER;
    }
}
