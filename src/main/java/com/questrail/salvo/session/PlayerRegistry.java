package com.questrail.salvo.session;

import com.questrail.salvo.transport.ConnectionHandle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * PlayerRegistry
 * -----------------------------------------------------------------------------
 * Unique-name index of connected players.
 *
 * <p>Shares the lobby lock with the {@link MatchmakingQueue}, so registration,
 * queueing and removal are mutually atomic. A name becomes available again as
 * soon as its player is unregistered.</p>
 */
public final class PlayerRegistry
{
    private static final Logger log = LoggerFactory.getLogger(PlayerRegistry.class);

    private final ReentrantLock lobbyLock;
    private final MatchmakingQueue queue;
    // Guarded by lobbyLock.
    private final Map<String, Player> players = new HashMap<>();

    public PlayerRegistry(ReentrantLock lobbyLock, MatchmakingQueue queue)
    {
        this.lobbyLock = Objects.requireNonNull(lobbyLock, "lobbyLock");
        this.queue = Objects.requireNonNull(queue, "queue");
    }

    /**
     * Register a name for a connection. Names are compared exactly.
     *
     * @throws NameTakenException       if a live player already has the name
     * @throws IllegalArgumentException if the name is blank
     */
    public Player register(String name, ConnectionHandle handle)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handle, "handle");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Name must not be empty");
        }

        lobbyLock.lock();
        try {
            if (players.containsKey(name)) {
                throw new NameTakenException(name);
            }
            Player player = new Player(name, handle);
            players.put(name, player);
            log.debug("Registered {} on {}", player, handle);
            return player;
        } finally {
            lobbyLock.unlock();
        }
    }

    public Optional<Player> lookup(String name)
    {
        lobbyLock.lock();
        try {
            return Optional.ofNullable(players.get(name));
        } finally {
            lobbyLock.unlock();
        }
    }

    /**
     * Remove a player: free its name, drop it from the queue, and end its
     * session if it was playing. Safe to call more than once.
     */
    public void unregister(Player player)
    {
        Objects.requireNonNull(player, "player");
        Optional<GameSession> session;

        lobbyLock.lock();
        try {
            players.remove(player.name(), player);
            queue.remove(player);
            player.markDeparted();
            session = player.session();
        } finally {
            lobbyLock.unlock();
        }

        // Lock order is lobby then session; only pairing takes both.
        session.ifPresent(s -> s.playerDisconnected(player));
        log.debug("Unregistered {}", player);
    }

    public int size()
    {
        lobbyLock.lock();
        try {
            return players.size();
        } finally {
            lobbyLock.unlock();
        }
    }

    public List<String> names()
    {
        lobbyLock.lock();
        try {
            return new ArrayList<>(players.keySet());
        } finally {
            lobbyLock.unlock();
        }
    }
}
