package com.questrail.salvo.server;

import com.questrail.salvo.observability.ConnectionEvent;
import com.questrail.salvo.observability.ProtocolObservabilityEvent;
import com.questrail.salvo.observability.SalvoErrorEvent;
import com.questrail.salvo.observability.SalvoObservabilitySink;
import com.questrail.salvo.protocol.codec.MalformedMessageException;
import com.questrail.salvo.protocol.codec.SalvoMessageDecoder;
import com.questrail.salvo.protocol.codec.SalvoMessageEncoder;
import com.questrail.salvo.protocol.codec.UnknownMessageTypeException;
import com.questrail.salvo.protocol.model.ErrorMessage;
import com.questrail.salvo.protocol.model.NameRequest;
import com.questrail.salvo.protocol.model.Ping;
import com.questrail.salvo.protocol.model.Pong;
import com.questrail.salvo.protocol.model.SalvoMessage;
import com.questrail.salvo.protocol.model.SetupComplete;
import com.questrail.salvo.protocol.model.ShipPlacement;
import com.questrail.salvo.protocol.model.Shot;
import com.questrail.salvo.protocol.model.WaitingForOpponent;
import com.questrail.salvo.session.GameSession;
import com.questrail.salvo.session.MatchmakingQueue;
import com.questrail.salvo.session.NameTakenException;
import com.questrail.salvo.session.Pairing;
import com.questrail.salvo.session.Player;
import com.questrail.salvo.session.PlayerRegistry;
import com.questrail.salvo.session.SessionRegistry;
import com.questrail.salvo.session.state.SessionStateReducer;
import com.questrail.salvo.transport.ConnectionHandle;
import com.questrail.salvo.transport.DisconnectReason;
import com.questrail.salvo.transport.LineChannel;
import com.questrail.salvo.transport.LineChannelListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SalvoServer
 * =============================================================================
 * The server aggregate: owns the player registry, the matchmaking queue and
 * the session registry, and drives every accepted connection through its
 * lifecycle.
 *
 * <h2>Connection lifecycle</h2>
 * <ol>
 *   <li><b>Handshake</b>: the first line must be a {@code name} record with a
 *       non-blank, unused name. Anything else is answered with {@code error}
 *       and the connection is closed.</li>
 *   <li><b>Lobby</b>: the player is registered and either queued
 *       ({@code waiting_for_opponent}) or paired ({@code session_start} to both).</li>
 *   <li><b>Play</b>: each decoded message is routed to the player's session.
 *       Malformed and unknown frames are reported and skipped.</li>
 *   <li><b>Departure</b>: on close the player is unregistered, which removes it
 *       from the queue or ends its session.</li>
 * </ol>
 *
 * <h2>Threading</h2>
 * The transport delivers the callbacks of one connection sequentially; the
 * callbacks of different connections may run concurrently. All cross-connection
 * state lives behind the lobby lock or a session lock.
 *
 * <h2>Transport independence</h2>
 * This class sees only {@link LineChannel}; it is bound to a concrete
 * transport by the runtime.
 */
public final class SalvoServer implements LineChannelListener
{
    private static final Logger log = LoggerFactory.getLogger(SalvoServer.class);

    static final String NAME_TAKEN = "Name already taken";
    static final String NAME_EMPTY = "Name must not be empty";
    static final String NAME_EXPECTED = "Expected name message";

    private final SalvoMessageDecoder decoder;
    private final SalvoMessageEncoder encoder;
    private final SalvoObservabilitySink sink;
    private final Clock clock;

    private final SessionRegistry sessions;
    private final MatchmakingQueue queue;
    private final PlayerRegistry players;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    /**
     * Per-connection context. Fields are only written on the connection's own
     * callback thread.
     */
    private static final class Connection
    {
        final ConnectionHandle handle;
        volatile Player player;

        Connection(ConnectionHandle handle) {
            this.handle = handle;
        }
    }

    public SalvoServer(SalvoMessageDecoder decoder,
                       SalvoMessageEncoder encoder,
                       SalvoObservabilitySink sink,
                       Clock clock)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");

        ReentrantLock lobbyLock = new ReentrantLock();
        this.sessions = new SessionRegistry(new SessionStateReducer(), sink, clock);
        this.queue = new MatchmakingQueue(lobbyLock, sessions);
        this.players = new PlayerRegistry(lobbyLock, queue);
    }

    public PlayerRegistry players()
    {
        return players;
    }

    public MatchmakingQueue queue()
    {
        return queue;
    }

    public SessionRegistry sessions()
    {
        return sessions;
    }

    public int connectionCount()
    {
        return connections.size();
    }

    // ---------------------------------------------------------------------
    // LineChannelListener
    // ---------------------------------------------------------------------

    @Override
    public void onOpen(LineChannel channel)
    {
        connections.put(channel.id(), new Connection(new ConnectionHandle(channel, encoder)));
        sink.onConnectionEvent(new ConnectionEvent(
                clock.instant(), ConnectionEvent.Kind.OPENED, channel.id(), channel.remoteAddress(), null));
    }

    @Override
    public void onLine(LineChannel channel, String line)
    {
        Connection conn = connections.get(channel.id());
        if (conn == null) {
            log.debug("Line for unknown connection {} ignored", channel.id());
            return;
        }
        // Lines already read from a connection we have closed are not processed;
        // the close notification follows the read batch.
        if (!conn.handle.isOpen()) {
            log.debug("Line from closed connection {} discarded", channel.id());
            return;
        }
        if (conn.player == null) {
            handshake(conn, line);
        } else {
            dispatch(conn, line);
        }
    }

    @Override
    public void onIdle(LineChannel channel)
    {
        Connection conn = connections.get(channel.id());
        if (conn != null && conn.player != null) {
            conn.handle.send(new Ping());
        }
    }

    @Override
    public void onFrameError(LineChannel channel, Throwable cause)
    {
        Connection conn = connections.get(channel.id());
        if (conn != null && !conn.handle.isOpen()) {
            return;
        }
        if (conn != null && conn.player == null) {
            // An unreadable first frame is a failed handshake.
            rejectHandshake(conn, NAME_EXPECTED, cause.getMessage());
            return;
        }
        protocolEvent(ProtocolObservabilityEvent.Kind.MALFORMED_MESSAGE, sourceOf(conn, channel), cause.getMessage());
    }

    @Override
    public void onClose(LineChannel channel, DisconnectReason reason, Throwable cause)
    {
        Connection conn = connections.remove(channel.id());
        sink.onConnectionEvent(new ConnectionEvent(
                clock.instant(), ConnectionEvent.Kind.CLOSED, channel.id(), channel.remoteAddress(), reason));
        if (cause != null) {
            sink.onError(new SalvoErrorEvent(clock.instant(),
                    "Connection " + channel.id() + " failed (" + reason + ")", cause));
        }
        if (conn == null) {
            return;
        }
        conn.handle.close(reason);
        Player player = conn.player;
        if (player != null) {
            players.unregister(player);
        }
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * End every live session without notifying players, then close every
     * connection with {@link DisconnectReason#SERVER_SHUTDOWN}.
     */
    public void shutdown()
    {
        sessions.shutdownAll();
        List<Connection> open = new ArrayList<>(connections.values());
        for (Connection c : open) {
            c.handle.close(DisconnectReason.SERVER_SHUTDOWN);
        }
        log.info("Salvo server shut down ({} connection(s) closed)", open.size());
    }

    // ---------------------------------------------------------------------
    // Handshake
    // ---------------------------------------------------------------------

    private void handshake(Connection conn, String line)
    {
        NameRequest request;
        try {
            request = decoder.decodeHandshake(line);
        } catch (MalformedMessageException e) {
            rejectHandshake(conn, NAME_EXPECTED, e.getMessage());
            return;
        }

        String name = request.name();
        if (name.isBlank()) {
            rejectHandshake(conn, NAME_EMPTY, "blank name");
            return;
        }

        Player player;
        try {
            player = players.register(name, conn.handle);
        } catch (NameTakenException e) {
            protocolEvent(ProtocolObservabilityEvent.Kind.NAME_TAKEN, conn.handle.id(), e.getMessage());
            conn.handle.send(new ErrorMessage(NAME_TAKEN));
            conn.handle.close(DisconnectReason.HANDSHAKE_REJECTED);
            return;
        }
        conn.player = player;

        Pairing pairing = queue.enqueueOrPair(player);
        if (!pairing.isPaired()) {
            player.handle().send(new WaitingForOpponent());
        }
    }

    private void rejectHandshake(Connection conn, String clientMessage, String detail)
    {
        protocolEvent(ProtocolObservabilityEvent.Kind.HANDSHAKE_REJECTED, conn.handle.id(), detail);
        conn.handle.send(new ErrorMessage(clientMessage));
        conn.handle.close(DisconnectReason.HANDSHAKE_REJECTED);
    }

    // ---------------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------------

    private void dispatch(Connection conn, String line)
    {
        Player player = conn.player;
        SalvoMessage message;
        try {
            message = decoder.decode(line);
        } catch (UnknownMessageTypeException e) {
            protocolEvent(ProtocolObservabilityEvent.Kind.UNKNOWN_MESSAGE_TYPE, player.name(), e.typeName());
            return;
        } catch (MalformedMessageException e) {
            protocolEvent(ProtocolObservabilityEvent.Kind.MALFORMED_MESSAGE, player.name(), e.getMessage());
            return;
        }

        switch (message.type()) {
            case PING -> conn.handle.send(new Pong());
            case PONG -> { }
            case SHIP_PLACEMENT, SETUP_COMPLETE, SHOT, SHOT_RESULT, CHAT, GAME_OVER -> route(player, message);
            case NAME -> log.debug("{} sent a second name record; ignored", player);
            default -> protocolEvent(ProtocolObservabilityEvent.Kind.UNKNOWN_MESSAGE_TYPE, player.name(),
                    message.type().wireName() + " is not accepted from clients");
        }
    }

    private void route(Player player, SalvoMessage message)
    {
        Optional<GameSession> session = player.session();
        if (session.isEmpty()) {
            protocolEvent(ProtocolObservabilityEvent.Kind.SESSION_NOT_FOUND, player.name(),
                    message.type().wireName() + " received outside a session");
            return;
        }
        GameSession s = session.get();
        if (log.isDebugEnabled()) {
            checkClaimedSlot(s, player, message);
        }
        s.handle(player, message);
    }

    // The session trusts the connection, not the player_num field.
    private static void checkClaimedSlot(GameSession session, Player player, SalvoMessage message)
    {
        int claimed;
        if (message instanceof Shot m) {
            claimed = m.playerNum();
        } else if (message instanceof SetupComplete m) {
            claimed = m.playerNum();
        } else if (message instanceof ShipPlacement m) {
            claimed = m.playerNum();
        } else {
            return;
        }
        int actual = session.slotOf(player).number();
        if (claimed != actual) {
            log.debug("{} claimed player_num {} but holds slot {} in session {}",
                    player, claimed, actual, session.id());
        }
    }

    private void protocolEvent(ProtocolObservabilityEvent.Kind kind, String source, String detail)
    {
        sink.onProtocolEvent(new ProtocolObservabilityEvent(
                clock.instant(), kind, source, detail == null ? "" : detail));
    }

    private static String sourceOf(Connection conn, LineChannel channel)
    {
        if (conn != null && conn.player != null) {
            return conn.player.name();
        }
        return channel.id();
    }
}
