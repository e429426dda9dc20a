package com.questrail.salvo.session;

import com.questrail.salvo.transport.ConnectionHandle;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A registered participant: a unique display name bound to one connection.
 *
 * <p>Identity is object identity; two players are never equal unless they
 * are the same registration. The session reference is written by the
 * matchmaking queue (under the lobby lock) and cleared by the session when it
 * ends; it may be read from any thread.</p>
 */
public final class Player
{
    private final String name;
    private final ConnectionHandle handle;
    private final AtomicReference<GameSession> session = new AtomicReference<>();
    private volatile boolean departed;

    Player(String name, ConnectionHandle handle)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.handle = Objects.requireNonNull(handle, "handle");
    }

    public String name()
    {
        return name;
    }

    public ConnectionHandle handle()
    {
        return handle;
    }

    /**
     * The live session this player is seated in, if any.
     */
    public Optional<GameSession> session()
    {
        return Optional.ofNullable(session.get());
    }

    /**
     * Whether the player has been unregistered.
     */
    public boolean isDeparted()
    {
        return departed;
    }

    void bindSession(GameSession gameSession)
    {
        Objects.requireNonNull(gameSession, "gameSession");
        if (!session.compareAndSet(null, gameSession)) {
            throw new IllegalStateException("Player '" + name + "' is already in session " + session.get().id());
        }
    }

    void unbindSession(GameSession gameSession)
    {
        session.compareAndSet(gameSession, null);
    }

    void markDeparted()
    {
        departed = true;
    }

    @Override
    public String toString()
    {
        return "Player[" + name + "]";
    }
}
