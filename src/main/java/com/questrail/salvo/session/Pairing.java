package com.questrail.salvo.session;

import java.util.Optional;

/**
 * Outcome of {@link MatchmakingQueue#enqueueOrPair(Player)}.
 */
public final class Pairing
{
    private static final Pairing QUEUED = new Pairing(null);

    private final GameSession session;

    private Pairing(GameSession session) {
        this.session = session;
    }

    static Pairing queued() {
        return QUEUED;
    }

    static Pairing paired(GameSession session) {
        return new Pairing(session);
    }

    public boolean isPaired() {
        return session != null;
    }

    /**
     * The session created for the pair; empty if the player was queued.
     */
    public Optional<GameSession> session() {
        return Optional.ofNullable(session);
    }

    @Override
    public String toString() {
        return session == null ? "Pairing[queued]" : "Pairing[session " + session.id() + "]";
    }
}
