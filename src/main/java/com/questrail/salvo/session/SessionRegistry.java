package com.questrail.salvo.session;

import com.questrail.salvo.observability.SalvoObservabilitySink;
import com.questrail.salvo.session.state.SessionStateReducer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide index of live game sessions by id.
 *
 * <p>Ids are allocated from a monotonically increasing counter starting at 1
 * and are never reused. A session removes itself when it reaches
 * {@code GAME_OVER}.</p>
 */
public final class SessionRegistry
{
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final SessionStateReducer reducer;
    private final SalvoObservabilitySink sink;
    private final Clock clock;
    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, GameSession> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(SessionStateReducer reducer, SalvoObservabilitySink sink, Clock clock)
    {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Create and index a session. The caller announces it via {@link GameSession#open()}.
     */
    GameSession create(Player slotOne, Player slotTwo)
    {
        int id = nextId.getAndIncrement();
        GameSession session = new GameSession(id, slotOne, slotTwo, reducer, sink, clock, this::remove);
        sessions.put(id, session);
        return session;
    }

    public Optional<GameSession> lookup(int sessionId)
    {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    void remove(GameSession session)
    {
        sessions.remove(session.id(), session);
    }

    public int size()
    {
        return sessions.size();
    }

    public List<GameSession> activeSessions()
    {
        return new ArrayList<>(sessions.values());
    }

    /**
     * End every live session without notifying players.
     */
    public void shutdownAll()
    {
        List<GameSession> live = activeSessions();
        for (GameSession s : live) {
            s.forceGameOver();
        }
        if (!live.isEmpty()) {
            log.info("Ended {} live session(s) at shutdown", live.size());
        }
    }
}
