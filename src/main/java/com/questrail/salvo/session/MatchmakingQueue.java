package com.questrail.salvo.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * MatchmakingQueue
 * -----------------------------------------------------------------------------
 * FIFO of registered players waiting for an opponent.
 *
 * <h2>Atomic pairing</h2>
 * {@link #enqueueOrPair(Player)} pops the head, creates the session, announces
 * it to both players and seats them, all while holding the lobby lock. No
 * other caller can observe or claim the popped opponent in between, and no
 * player can be popped after {@link PlayerRegistry#unregister(Player)} has
 * removed it, because unregistration runs under the same lock.
 *
 * <h2>Removal</h2>
 * Waiting players are kept in an insertion-ordered identity set, so removing
 * a departed player is O(1).
 */
public final class MatchmakingQueue
{
    private static final Logger log = LoggerFactory.getLogger(MatchmakingQueue.class);

    private final ReentrantLock lobbyLock;
    private final SessionRegistry sessions;
    // Guarded by lobbyLock. Player does not override equals, so this is an identity set.
    private final LinkedHashSet<Player> waiting = new LinkedHashSet<>();

    public MatchmakingQueue(ReentrantLock lobbyLock, SessionRegistry sessions)
    {
        this.lobbyLock = Objects.requireNonNull(lobbyLock, "lobbyLock");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
    }

    /**
     * Pair the player with the longest-waiting opponent, or queue it.
     *
     * <p>The opponent takes slot 1 and the arriving player slot 2. Both
     * receive {@code session_start} before this method returns.</p>
     *
     * @throws IllegalStateException if the player has departed, is already
     *         queued, or is already seated in a session
     */
    public Pairing enqueueOrPair(Player player)
    {
        Objects.requireNonNull(player, "player");
        lobbyLock.lock();
        try {
            if (player.isDeparted()) {
                throw new IllegalStateException(player + " has departed");
            }
            if (waiting.contains(player) || player.session().isPresent()) {
                throw new IllegalStateException(player + " is already queued or playing");
            }

            Iterator<Player> it = waiting.iterator();
            if (!it.hasNext()) {
                waiting.add(player);
                log.debug("{} queued ({} waiting)", player, waiting.size());
                return Pairing.queued();
            }

            Player opponent = it.next();
            it.remove();

            GameSession session = sessions.create(opponent, player);
            session.open();
            log.info("Paired {} with {} in session {}", opponent, player, session.id());
            return Pairing.paired(session);
        } finally {
            lobbyLock.unlock();
        }
    }

    /**
     * Remove a waiting player.
     *
     * @return {@code true} if the player was waiting
     */
    public boolean remove(Player player)
    {
        Objects.requireNonNull(player, "player");
        lobbyLock.lock();
        try {
            return waiting.remove(player);
        } finally {
            lobbyLock.unlock();
        }
    }

    public boolean contains(Player player)
    {
        lobbyLock.lock();
        try {
            return waiting.contains(player);
        } finally {
            lobbyLock.unlock();
        }
    }

    public int size()
    {
        lobbyLock.lock();
        try {
            return waiting.size();
        } finally {
            lobbyLock.unlock();
        }
    }

    /**
     * Snapshot of waiting player names, head first.
     */
    public List<String> waitingNames()
    {
        lobbyLock.lock();
        try {
            List<String> names = new ArrayList<>(waiting.size());
            for (Player p : waiting) {
                names.add(p.name());
            }
            return names;
        } finally {
            lobbyLock.unlock();
        }
    }
}
