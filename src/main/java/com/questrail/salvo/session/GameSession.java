package com.questrail.salvo.session;

import com.questrail.salvo.observability.ProtocolObservabilityEvent;
import com.questrail.salvo.observability.SalvoObservabilitySink;
import com.questrail.salvo.observability.SessionTransitionEvent;
import com.questrail.salvo.protocol.model.Chat;
import com.questrail.salvo.protocol.model.SalvoMessage;
import com.questrail.salvo.protocol.model.SessionStart;
import com.questrail.salvo.session.state.SessionIntents;
import com.questrail.salvo.session.state.SessionRejection;
import com.questrail.salvo.session.state.SessionState;
import com.questrail.salvo.session.state.SessionStateReducer;
import com.questrail.salvo.session.state.Slot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * GameSession
 * =============================================================================
 * Owner of one paired game: two seated players, the arbitration state and the
 * lock that serializes every event touching them.
 *
 * <h2>Execution model</h2>
 * Each event (an inbound message or a disconnect) is applied in three steps
 * under the session lock:
 * <ol>
 *   <li>the pure {@link SessionStateReducer} computes the new state and deliveries</li>
 *   <li>the state is replaced</li>
 *   <li>the deliveries are handed to the players' connections in order</li>
 * </ol>
 * Holding the lock through step 3 keeps the per-recipient order of messages
 * identical to the order in which the session accepted the events. Sends never
 * block, so the lock is only held for the duration of an enqueue.
 *
 * <h2>Termination</h2>
 * When the state reaches {@code GAME_OVER} the session unseats both players
 * and reports itself to the {@code onTerminated} callback exactly once. Events
 * arriving afterwards are discarded, {@code chat} included: chat is relayed in
 * every phase the session is reachable in, and an ended session is no longer
 * reachable from either player.
 */
public final class GameSession
{
    private static final Logger log = LoggerFactory.getLogger(GameSession.class);

    private final int id;
    private final Player slotOne;
    private final Player slotTwo;
    private final SessionStateReducer reducer;
    private final SalvoObservabilitySink sink;
    private final Clock clock;
    private final Consumer<GameSession> onTerminated;

    private final ReentrantLock lock = new ReentrantLock();
    // Guarded by lock.
    private SessionState state = SessionState.initial();
    private boolean terminated;

    GameSession(int id,
                Player slotOne,
                Player slotTwo,
                SessionStateReducer reducer,
                SalvoObservabilitySink sink,
                Clock clock,
                Consumer<GameSession> onTerminated)
    {
        if (slotOne == slotTwo) {
            throw new IllegalArgumentException("A player cannot be paired with itself");
        }
        this.id = id;
        this.slotOne = Objects.requireNonNull(slotOne, "slotOne");
        this.slotTwo = Objects.requireNonNull(slotTwo, "slotTwo");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.onTerminated = Objects.requireNonNull(onTerminated, "onTerminated");
    }

    public int id()
    {
        return id;
    }

    public Player player(Slot slot)
    {
        return slot == Slot.ONE ? slotOne : slotTwo;
    }

    /**
     * Slot occupied by {@code player}.
     *
     * @throws IllegalArgumentException if the player is not seated here
     */
    public Slot slotOf(Player player)
    {
        if (player == slotOne) {
            return Slot.ONE;
        }
        if (player == slotTwo) {
            return Slot.TWO;
        }
        throw new IllegalArgumentException(player + " is not in session " + id);
    }

    public SessionState state()
    {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminated()
    {
        lock.lock();
        try {
            return terminated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Seat both players and announce the session to them. Called once.
     *
     * <p>Seating happens under the session lock, so an inbound message that
     * finds the session through {@link Player#session()} waits until both
     * {@code session_start} records have been sent.</p>
     *
     * @throws IllegalStateException if either player is already seated
     */
    void open()
    {
        lock.lock();
        try {
            slotOne.bindSession(this);
            slotTwo.bindSession(this);
            slotOne.handle().send(new SessionStart(id, Slot.ONE.number(), slotTwo.name()));
            slotTwo.handle().send(new SessionStart(id, Slot.TWO.number(), slotOne.name()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply one inbound message from a seated player.
     */
    public void handle(Player sender, SalvoMessage message)
    {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(message, "message");
        Slot slot = slotOf(sender);

        // The display name is always the server's, never the client's.
        SalvoMessage stamped = message instanceof Chat chat
                ? new Chat(sender.name(), chat.text())
                : message;

        lock.lock();
        try {
            if (terminated) {
                log.debug("Session {} already ended; dropping {} from {}", id, message.type(), sender);
                return;
            }
            SessionStateReducer.Result result = reducer.apply(state, slot, stamped);
            result.intents().rejection().ifPresent(r -> reportRejection(sender, message, r));
            commit(result, message.type().wireName());
        } finally {
            lock.unlock();
        }
    }

    /**
     * A seated player's connection is gone. The opponent is told at most once.
     */
    public void playerDisconnected(Player departed)
    {
        Slot slot = slotOf(departed);
        lock.lock();
        try {
            if (terminated) {
                return;
            }
            commit(reducer.playerDisconnected(state, slot), "disconnect:" + departed.name());
        } finally {
            lock.unlock();
        }
    }

    /**
     * End the session without notifying either player. Used at shutdown.
     */
    void forceGameOver()
    {
        lock.lock();
        try {
            if (terminated) {
                return;
            }
            commit(reducer.playerDisconnected(state, Slot.ONE), "shutdown", false);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Internals (lock held)
    // ---------------------------------------------------------------------

    private void commit(SessionStateReducer.Result result, String trigger)
    {
        commit(result, trigger, true);
    }

    private void commit(SessionStateReducer.Result result, String trigger, boolean deliver)
    {
        SessionState previous = state;
        state = result.newState();

        if (previous.phase() != state.phase()) {
            sink.onSessionTransition(new SessionTransitionEvent(
                    clock.instant(), id, previous.phase(), state.phase(), trigger));
        }

        if (deliver) {
            for (SessionIntents.Delivery d : result.intents().deliveries()) {
                player(d.target()).handle().send(d.message());
            }
        }

        if (state.isTerminal() && !terminated) {
            terminated = true;
            slotOne.unbindSession(this);
            slotTwo.unbindSession(this);
            onTerminated.accept(this);
            log.info("Session {} ended ({})", id, trigger);
        }
    }

    private void reportRejection(Player sender, SalvoMessage message, SessionRejection rejection)
    {
        ProtocolObservabilityEvent.Kind kind = rejection == SessionRejection.OUT_OF_TURN
                ? ProtocolObservabilityEvent.Kind.OUT_OF_TURN
                : ProtocolObservabilityEvent.Kind.REJECTED_BY_SESSION;
        sink.onProtocolEvent(new ProtocolObservabilityEvent(
                clock.instant(), kind, sender.name(),
                "session " + id + ": " + message.type().wireName() + " rejected (" + rejection + ")"));
    }

    @Override
    public String toString()
    {
        return "GameSession[" + id + " " + slotOne.name() + " vs " + slotTwo.name() + "]";
    }
}
