package com.questrail.salvo.protocol.model;

import java.util.Optional;

/**
 * Outcome of a shot as self-reported by the targeted player's client.
 *
 * <p>The server never recomputes this value. It only uses it to decide
 * turn ownership: a {@link #MISS} passes the turn, a {@link #HIT} or
 * {@link #SUNK} lets the shooter fire again.</p>
 */
public enum ShotOutcome {
    HIT("hit"),
    MISS("miss"),
    SUNK("sunk");

    private final String wireName;

    ShotOutcome(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Whether the shooter keeps the turn after this outcome.
     */
    public boolean shooterKeepsTurn() {
        return this != MISS;
    }

    public static Optional<ShotOutcome> fromWireName(String wireName) {
        for (ShotOutcome outcome : values()) {
            if (outcome.wireName.equals(wireName)) {
                return Optional.of(outcome);
            }
        }
        return Optional.empty();
    }
}
