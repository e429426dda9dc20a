package com.questrail.salvo.protocol.model;

import java.util.Objects;

/**
 * The targeted player's self-reported outcome of a shot.
 *
 * <p>Received from the targeted client and broadcast to both players. The
 * outcome is trusted as reported; the server is a turn arbiter, not a
 * game-rules authority.</p>
 *
 * @param player slot of the shooter
 */
public record ShotResult(int player, int row, int col, ShotOutcome result) implements SalvoMessage {
    public ShotResult {
        Objects.requireNonNull(result, "result");
    }

    @Override
    public MessageType type() {
        return MessageType.SHOT_RESULT;
    }
}
