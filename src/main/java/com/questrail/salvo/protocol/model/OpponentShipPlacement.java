package com.questrail.salvo.protocol.model;

import java.util.Objects;

/**
 * Relay of the opponent's {@link ShipPlacement}.
 */
public record OpponentShipPlacement(RawJson ship) implements SalvoMessage {
    public OpponentShipPlacement {
        Objects.requireNonNull(ship, "ship");
    }

    @Override
    public MessageType type() {
        return MessageType.OPPONENT_SHIP_PLACEMENT;
    }
}
