package com.questrail.salvo.protocol.model;

/**
 * Relay of an accepted {@link Shot} to the targeted player only.
 *
 * <p>The receiver evaluates the shot against its own fleet and answers with
 * a {@link ShotResult}.</p>
 *
 * @param player slot of the shooter
 */
public record ReceiveShot(int row, int col, int player) implements SalvoMessage {
    @Override
    public MessageType type() {
        return MessageType.RECEIVE_SHOT;
    }
}
