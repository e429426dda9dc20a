package com.questrail.salvo.session.state;

import com.questrail.salvo.protocol.model.Chat;
import com.questrail.salvo.protocol.model.GameOver;
import com.questrail.salvo.protocol.model.GameplayStart;
import com.questrail.salvo.protocol.model.OpponentDisconnected;
import com.questrail.salvo.protocol.model.OpponentShipPlacement;
import com.questrail.salvo.protocol.model.ReceiveShot;
import com.questrail.salvo.protocol.model.SalvoMessage;
import com.questrail.salvo.protocol.model.SetupComplete;
import com.questrail.salvo.protocol.model.SetupUpdate;
import com.questrail.salvo.protocol.model.ShipPlacement;
import com.questrail.salvo.protocol.model.Shot;
import com.questrail.salvo.protocol.model.ShotResult;
import com.questrail.salvo.protocol.model.TurnChange;

import java.util.Objects;

/**
 * SessionStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for one game session.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link SessionState}, the sender's {@link Slot} and a single
 * inbound message, the reducer computes:
 * <ul>
 *   <li>a new {@link SessionState}</li>
 *   <li>the ordered deliveries ({@link SessionIntents}) the session must perform</li>
 * </ul>
 *
 * It is intentionally:
 * <ul>
 *   <li>Pure (no I/O, no locks, no clocks)</li>
 *   <li>Deterministic</li>
 *   <li>Unaware of connections and player names</li>
 * </ul>
 *
 * <h2>Arbitration rules</h2>
 * <ul>
 *   <li>The sender's slot is authoritative; {@code player_num} fields sent by
 *       clients are not used for arbitration.</li>
 *   <li>A shot is accepted only from the turn owner and only when no earlier
 *       shot is still awaiting its result.</li>
 *   <li>A shot result is accepted only from the targeted player and only for
 *       the pending shot's coordinates.</li>
 *   <li>A miss passes the turn; a hit or sunk lets the shooter fire again.</li>
 *   <li>Shot outcomes are trusted as reported.</li>
 * </ul>
 */
public final class SessionStateReducer
{
    /**
     * Result of applying an input to a session state.
     *
     * @param newState the updated session state
     * @param intents  deliveries to be executed by the caller
     */
    public record Result(SessionState newState, SessionIntents intents) {
        public Result {
            Objects.requireNonNull(newState, "newState");
            Objects.requireNonNull(intents, "intents");
        }
    }

    /**
     * Applies one inbound message from a player.
     *
     * <p>{@link Chat} messages are expected to already carry the sender's
     * display name.</p>
     *
     * @param state   the current state (must not be {@code null})
     * @param sender  slot of the sending player
     * @param message the message to apply (must not be {@code null})
     * @return the resulting state and deliveries
     */
    public Result apply(SessionState state, Slot sender, SalvoMessage message) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(message, "message");

        // Chat never touches the state machine.
        if (message instanceof Chat chat) {
            return new Result(state, SessionIntents.builder().broadcast(chat).build());
        }

        // Late game messages after the end are dropped without error.
        if (state.isTerminal()) {
            return new Result(state, SessionIntents.none());
        }

        if (message instanceof ShipPlacement m) {
            return onShipPlacement(state, sender, m);
        }
        if (message instanceof SetupComplete) {
            return onSetupComplete(state, sender);
        }
        if (message instanceof Shot m) {
            return onShot(state, sender, m);
        }
        if (message instanceof ShotResult m) {
            return onShotResult(state, sender, m);
        }
        if (message instanceof GameOver m) {
            return onGameOver(state, sender, m);
        }

        return reject(state, sender, SessionRejection.UNEXPECTED_MESSAGE);
    }

    /**
     * Applies the loss of a player's connection.
     *
     * <p>A live session ends and the surviving slot is told exactly once. A
     * session that has already ended is left untouched.</p>
     */
    public Result playerDisconnected(SessionState state, Slot departed) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(departed, "departed");

        if (state.isTerminal()) {
            return new Result(state, SessionIntents.none());
        }
        SessionIntents intents = SessionIntents.builder()
                .sendTo(departed.other(), new OpponentDisconnected())
                .build();
        return new Result(state.gameOver(), intents);
    }

    // ---------------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------------

    private Result onShipPlacement(SessionState state, Slot sender, ShipPlacement m) {
        if (state.phase() != SessionPhase.SETUP) {
            return reject(state, sender, SessionRejection.WRONG_PHASE);
        }
        // Relayed verbatim; placement legality is the clients' concern.
        SessionIntents intents = SessionIntents.builder()
                .sendTo(sender.other(), new OpponentShipPlacement(m.ship()))
                .build();
        return new Result(state, intents);
    }

    private Result onSetupComplete(SessionState state, Slot sender) {
        SessionIntents.Builder intents = SessionIntents.builder()
                .broadcast(new SetupUpdate(sender.number(), true));

        if (state.phase() != SessionPhase.SETUP) {
            // Already playing: re-announce readiness, never restart gameplay.
            return new Result(state, intents.build());
        }

        boolean one = state.slotOneReady() || sender == Slot.ONE;
        boolean two = state.slotTwoReady() || sender == Slot.TWO;

        if (one && two) {
            SessionState playing = new SessionState(SessionPhase.GAMEPLAY, true, true, Slot.ONE, null);
            intents.broadcast(new GameplayStart(Slot.ONE.number()));
            return new Result(playing, intents.build());
        }

        SessionState waiting = new SessionState(SessionPhase.SETUP, one, two, state.currentTurn(), null);
        return new Result(waiting, intents.build());
    }

    private Result onShot(SessionState state, Slot sender, Shot m) {
        if (state.phase() != SessionPhase.GAMEPLAY) {
            return reject(state, sender, SessionRejection.WRONG_PHASE);
        }
        if (sender != state.currentTurn()) {
            return reject(state, sender, SessionRejection.OUT_OF_TURN);
        }
        if (state.pending().isPresent()) {
            return reject(state, sender, SessionRejection.SHOT_PENDING);
        }

        SessionIntents intents = SessionIntents.builder()
                .sendTo(sender.other(), new ReceiveShot(m.row(), m.col(), sender.number()))
                .build();
        return new Result(state.withPendingShot(new SessionState.PendingShot(m.row(), m.col())), intents);
    }

    private Result onShotResult(SessionState state, Slot sender, ShotResult m) {
        if (state.phase() != SessionPhase.GAMEPLAY) {
            return reject(state, sender, SessionRejection.WRONG_PHASE);
        }
        Slot shooter = state.currentTurn();
        if (sender != shooter.other()) {
            return reject(state, sender, SessionRejection.NOT_SHOT_TARGET);
        }
        SessionState.PendingShot pending = state.pendingShot();
        if (pending == null) {
            return reject(state, sender, SessionRejection.NO_PENDING_SHOT);
        }
        if (!pending.matches(m.row(), m.col())) {
            return reject(state, sender, SessionRejection.RESULT_MISMATCH);
        }

        SessionIntents.Builder intents = SessionIntents.builder()
                .broadcast(new ShotResult(shooter.number(), m.row(), m.col(), m.result()));

        SessionState resolved = state.withPendingShot(null);
        if (!m.result().shooterKeepsTurn()) {
            Slot next = shooter.other();
            resolved = resolved.withTurn(next);
            intents.broadcast(new TurnChange(next.number()));
        }
        return new Result(resolved, intents.build());
    }

    private Result onGameOver(SessionState state, Slot sender, GameOver m) {
        if (!Slot.isValidNumber(m.winner())) {
            return reject(state, sender, SessionRejection.INVALID_WINNER);
        }
        SessionIntents intents = SessionIntents.builder()
                .broadcast(new GameOver(m.winner()))
                .build();
        return new Result(state.gameOver(), intents);
    }

    private static Result reject(SessionState state, Slot sender, SessionRejection rejection) {
        return new Result(state, SessionIntents.rejected(sender, rejection));
    }
}
