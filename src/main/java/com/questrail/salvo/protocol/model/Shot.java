package com.questrail.salvo.protocol.model;

/**
 * A client fires at a cell of the opponent's board.
 */
public record Shot(int playerNum, int row, int col) implements SalvoMessage {
    @Override
    public MessageType type() {
        return MessageType.SHOT;
    }
}
