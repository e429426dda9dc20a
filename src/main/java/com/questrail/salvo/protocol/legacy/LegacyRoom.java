package com.questrail.salvo.protocol.legacy;

import com.questrail.salvo.protocol.codec.MalformedMessageException;
import com.questrail.salvo.protocol.model.ShotOutcome;
import com.questrail.salvo.transport.DisconnectReason;
import com.questrail.salvo.transport.LineChannel;
import com.questrail.salvo.transport.LineChannelListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;

/**
 * LegacyRoom
 * =============================================================================
 * A single fixed two-seat room speaking the pipe-delimited protocol.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>Each arrival takes the lowest free seat and receives {@code PLAYER|<id>}.
 *       The first one also receives {@code WAIT|}; a third is refused.</li>
 *   <li>With both seats taken, both players receive {@code SHIPS}. Each answers
 *       {@code YOURPLACEMENT|}; when both have, both receive {@code START|1}.</li>
 *   <li>The turn owner sends {@code FIRE <row> <col>|}. The room draws the
 *       outcome itself and broadcasts {@code SHOT|...}. A miss passes the turn
 *       and is followed by {@code START|<turn>}.</li>
 *   <li>When a player leaves, the other receives {@code QUIT|<id>} and the
 *       game resets; the free seat can be taken again.</li>
 * </ol>
 *
 * <p>Unlike the session protocol, outcomes are not reported by clients: there
 * are no boards here, so each shot is a coin toss drawn from the injected
 * {@link Random}.</p>
 *
 * <h2>Thread Safety</h2>
 * All room state is guarded by the room monitor.
 */
public final class LegacyRoom implements LineChannelListener
{
    private static final Logger log = LoggerFactory.getLogger(LegacyRoom.class);

    public static final int BOARD_SIZE = 10;

    static final String ROOM_FULL = "Room full";
    static final String NOT_YOUR_TURN = "Not your turn";
    static final String NOT_STARTED = "Game not started";
    static final String ALREADY_STARTED = "Game already started";
    static final String NO_OPPONENT = "Waiting for opponent";
    static final String OUT_OF_RANGE = "Coordinates out of range";
    static final String LINE_TOO_LONG = "Line too long";

    private final Random random;

    // Guarded by this. Index 0 is seat 1.
    private final LineChannel[] seats = new LineChannel[2];
    private final boolean[] placed = new boolean[2];
    private boolean started;
    private int turn = 1;

    public LegacyRoom(Random random)
    {
        this.random = Objects.requireNonNull(random, "random");
    }

    // ---------------------------------------------------------------------
    // LineChannelListener
    // ---------------------------------------------------------------------

    @Override
    public synchronized void onOpen(LineChannel channel)
    {
        int seat = freeSeat();
        if (seat < 0) {
            channel.sendLine(LegacyPipeCodec.error(ROOM_FULL));
            channel.close(DisconnectReason.HANDSHAKE_REJECTED);
            return;
        }
        seats[seat] = channel;
        int id = seat + 1;
        channel.sendLine(LegacyPipeCodec.player(id));
        log.info("Legacy player {} seated from {}", id, channel.remoteAddress());

        if (seats[1 - seat] == null) {
            channel.sendLine(LegacyPipeCodec.waitForOpponent());
        } else {
            resetGame();
            broadcast(LegacyPipeCodec.ships());
        }
    }

    @Override
    public synchronized void onLine(LineChannel channel, String line)
    {
        int id = idOf(channel);
        if (id < 0) {
            return;
        }

        LegacyCommand command;
        try {
            command = LegacyPipeCodec.parse(line);
        } catch (MalformedMessageException e) {
            channel.sendLine(LegacyPipeCodec.error(e.getMessage()));
            return;
        }

        if (command instanceof LegacyCommand.Ping) {
            channel.sendLine(LegacyPipeCodec.pong());
        } else if (command instanceof LegacyCommand.PlacementDone) {
            onPlacementDone(channel, id);
        } else if (command instanceof LegacyCommand.Fire fire) {
            onFire(channel, id, fire);
        } else if (command instanceof LegacyCommand.Quit) {
            channel.close(DisconnectReason.REMOTE_CLOSED);
        }
    }

    @Override
    public void onIdle(LineChannel channel)
    {
        channel.sendLine(LegacyPipeCodec.ping());
    }

    @Override
    public void onFrameError(LineChannel channel, Throwable cause)
    {
        channel.sendLine(LegacyPipeCodec.error(LINE_TOO_LONG));
    }

    @Override
    public synchronized void onClose(LineChannel channel, DisconnectReason reason, Throwable cause)
    {
        int id = idOf(channel);
        if (id < 0) {
            return;
        }
        seats[id - 1] = null;
        resetGame();
        log.info("Legacy player {} left ({})", id, reason);

        LineChannel other = seats[2 - id];
        if (other != null) {
            other.sendLine(LegacyPipeCodec.quit(id));
        }
    }

    // ---------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------

    public synchronized int occupancy()
    {
        return (seats[0] == null ? 0 : 1) + (seats[1] == null ? 0 : 1);
    }

    public synchronized boolean isStarted()
    {
        return started;
    }

    public synchronized int currentTurn()
    {
        return turn;
    }

    // ---------------------------------------------------------------------
    // Commands (monitor held)
    // ---------------------------------------------------------------------

    private void onPlacementDone(LineChannel channel, int id)
    {
        if (occupancy() < 2) {
            channel.sendLine(LegacyPipeCodec.error(NO_OPPONENT));
            return;
        }
        if (started) {
            channel.sendLine(LegacyPipeCodec.error(ALREADY_STARTED));
            return;
        }
        placed[id - 1] = true;
        if (placed[0] && placed[1]) {
            started = true;
            turn = 1;
            broadcast(LegacyPipeCodec.start(turn));
        }
    }

    private void onFire(LineChannel channel, int id, LegacyCommand.Fire fire)
    {
        if (!started) {
            channel.sendLine(LegacyPipeCodec.error(NOT_STARTED));
            return;
        }
        if (id != turn) {
            channel.sendLine(LegacyPipeCodec.error(NOT_YOUR_TURN));
            return;
        }
        if (!onBoard(fire.row()) || !onBoard(fire.col())) {
            channel.sendLine(LegacyPipeCodec.error(OUT_OF_RANGE));
            return;
        }

        ShotOutcome outcome = random.nextBoolean() ? ShotOutcome.HIT : ShotOutcome.MISS;
        broadcast(LegacyPipeCodec.shot(id, fire.row(), fire.col(), outcome.wireName()));
        if (!outcome.shooterKeepsTurn()) {
            turn = 3 - turn;
            broadcast(LegacyPipeCodec.start(turn));
        }
    }

    private void resetGame()
    {
        placed[0] = false;
        placed[1] = false;
        started = false;
        turn = 1;
    }

    private void broadcast(String line)
    {
        for (LineChannel seat : seats) {
            if (seat != null) {
                seat.sendLine(line);
            }
        }
    }

    private int freeSeat()
    {
        if (seats[0] == null) {
            return 0;
        }
        return seats[1] == null ? 1 : -1;
    }

    private int idOf(LineChannel channel)
    {
        if (seats[0] == channel) {
            return 1;
        }
        if (seats[1] == channel) {
            return 2;
        }
        return -1;
    }

    private static boolean onBoard(int coordinate)
    {
        return coordinate >= 0 && coordinate < BOARD_SIZE;
    }
}
