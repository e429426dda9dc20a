package com.questrail.salvo.protocol.model;

import java.util.Objects;

/**
 * A single ship placed by a client during setup.
 *
 * <p>The {@code ship} payload is opaque to the server; it is relayed to the
 * opponent as {@link OpponentShipPlacement} without any legality check.</p>
 */
public record ShipPlacement(int playerNum, RawJson ship) implements SalvoMessage {
    public ShipPlacement {
        Objects.requireNonNull(ship, "ship");
    }

    @Override
    public MessageType type() {
        return MessageType.SHIP_PLACEMENT;
    }
}
