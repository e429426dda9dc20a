package com.questrail.salvo.session.state;

import java.util.Objects;
import java.util.Optional;

/**
 * SessionState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of a game session's arbitration state.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code GAMEPLAY} implies both players are ready</li>
 *   <li>{@code SETUP} implies at least one player is not ready</li>
 *   <li>a pending shot exists only during {@code GAMEPLAY}</li>
 * </ul>
 *
 * @param pendingShot the relayed shot still awaiting its result, or {@code null}
 */
public record SessionState(
        SessionPhase phase,
        boolean slotOneReady,
        boolean slotTwoReady,
        Slot currentTurn,
        PendingShot pendingShot
) {
    /**
     * Coordinates of a shot that has been relayed to its target.
     */
    public record PendingShot(int row, int col) {
        public boolean matches(int otherRow, int otherCol) {
            return row == otherRow && col == otherCol;
        }
    }

    public SessionState {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(currentTurn, "currentTurn");
        boolean bothReady = slotOneReady && slotTwoReady;
        if (phase == SessionPhase.GAMEPLAY && !bothReady) {
            throw new IllegalArgumentException("GAMEPLAY requires both players ready");
        }
        if (phase == SessionPhase.SETUP && bothReady) {
            throw new IllegalArgumentException("SETUP requires at least one player not ready");
        }
        if (pendingShot != null && phase != SessionPhase.GAMEPLAY) {
            throw new IllegalArgumentException("A pending shot exists only during GAMEPLAY");
        }
    }

    /**
     * The state of a freshly paired session.
     */
    public static SessionState initial() {
        return new SessionState(SessionPhase.SETUP, false, false, Slot.ONE, null);
    }

    public boolean isReady(Slot slot) {
        return slot == Slot.ONE ? slotOneReady : slotTwoReady;
    }

    public Optional<PendingShot> pending() {
        return Optional.ofNullable(pendingShot);
    }

    public boolean isTerminal() {
        return phase == SessionPhase.GAME_OVER;
    }

    SessionState withPendingShot(PendingShot shot) {
        return new SessionState(phase, slotOneReady, slotTwoReady, currentTurn, shot);
    }

    SessionState withTurn(Slot turn) {
        return new SessionState(phase, slotOneReady, slotTwoReady, turn, pendingShot);
    }

    SessionState gameOver() {
        return new SessionState(SessionPhase.GAME_OVER, slotOneReady, slotTwoReady, currentTurn, null);
    }
}
