package com.questrail.salvo.protocol.legacy;

import com.questrail.salvo.transport.DisconnectReason;
import com.questrail.salvo.transport.FakeLineChannel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class LegacyRoomTest {

    /**
     * Random whose coin tosses are scripted: {@code true} is a hit.
     */
    private static final class ScriptedRandom extends Random {
        private final Deque<Boolean> tosses = new ArrayDeque<>();

        void next(boolean... values) {
            for (boolean v : values) {
                tosses.add(v);
            }
        }

        @Override
        public boolean nextBoolean() {
            if (tosses.isEmpty()) {
                throw new IllegalStateException("No scripted toss left");
            }
            return tosses.poll();
        }
    }

    private ScriptedRandom random;
    private LegacyRoom room;

    @BeforeEach
    void setUp() {
        random = new ScriptedRandom();
        room = new LegacyRoom(random);
    }

    private FakeLineChannel[] startedGame() {
        FakeLineChannel p1 = FakeLineChannel.connect(room, "1");
        FakeLineChannel p2 = FakeLineChannel.connect(room, "2");
        p1.receive("YOURPLACEMENT|");
        p2.receive("YOURPLACEMENT|");
        p1.clear();
        p2.clear();
        return new FakeLineChannel[] {p1, p2};
    }

    @Test
    void firstArrivalWaitsSecondTriggersPlacement() {
        FakeLineChannel p1 = FakeLineChannel.connect(room, "1");
        assertEquals(List.of("PLAYER|1", "WAIT|"), p1.sent());

        FakeLineChannel p2 = FakeLineChannel.connect(room, "2");

        assertEquals(List.of("PLAYER|1", "WAIT|", "SHIPS"), p1.sent());
        assertEquals(List.of("PLAYER|2", "SHIPS"), p2.sent());
        assertEquals(2, room.occupancy());
    }

    @Test
    void thirdArrivalIsTurnedAway() {
        FakeLineChannel.connect(room, "1");
        FakeLineChannel.connect(room, "2");

        FakeLineChannel p3 = FakeLineChannel.connect(room, "3");

        assertEquals(List.of("ERROR|Room full"), p3.sent());
        assertEquals(DisconnectReason.HANDSHAKE_REJECTED, p3.closedWith());
        assertEquals(2, room.occupancy());
    }

    @Test
    void gameStartsWhenBothPlacementsAreDone() {
        FakeLineChannel p1 = FakeLineChannel.connect(room, "1");
        FakeLineChannel p2 = FakeLineChannel.connect(room, "2");
        p1.clear();
        p2.clear();

        p2.receive("YOURPLACEMENT|");
        assertFalse(room.isStarted());
        p1.receive("YOURPLACEMENT|");

        assertTrue(room.isStarted());
        assertEquals(List.of("START|1"), p1.sent());
        assertEquals(List.of("START|1"), p2.sent());
    }

    @Test
    void placementWithoutOpponentIsAnError() {
        FakeLineChannel p1 = FakeLineChannel.connect(room, "1");
        p1.clear();

        p1.receive("YOURPLACEMENT|");

        assertEquals(List.of("ERROR|Waiting for opponent"), p1.sent());
    }

    @Test
    void hitKeepsTheTurnMissPassesIt() {
        FakeLineChannel[] p = startedGame();
        random.next(true, false);

        p[0].receive("FIRE 3 4|");
        p[0].receive("FIRE 5 5|");

        List<String> expected = List.of("SHOT|1|3|4|hit", "SHOT|1|5|5|miss", "START|2");
        assertEquals(expected, p[0].sent());
        assertEquals(expected, p[1].sent());
        assertEquals(2, room.currentTurn());
    }

    @Test
    void fireOutOfTurnIsRefused() {
        FakeLineChannel[] p = startedGame();

        p[1].receive("FIRE 0 0|");

        assertEquals(List.of("ERROR|Not your turn"), p[1].sent());
        assertTrue(p[0].sent().isEmpty());
    }

    @Test
    void fireBeforeStartAndOffBoardAreRefused() {
        FakeLineChannel p1 = FakeLineChannel.connect(room, "1");
        FakeLineChannel p2 = FakeLineChannel.connect(room, "2");
        p1.clear();

        p1.receive("FIRE 0 0|");
        assertEquals(List.of("ERROR|Game not started"), p1.sent());

        p1.receive("YOURPLACEMENT|");
        p2.receive("YOURPLACEMENT|");
        p1.clear();
        p1.receive("FIRE 10 0|");
        assertEquals(List.of("ERROR|Coordinates out of range"), p1.sent());
    }

    @Test
    void pingIsAnsweredAndGarbageGetsAnError() {
        FakeLineChannel p1 = FakeLineChannel.connect(room, "1");
        p1.clear();

        p1.receive("PING|");
        p1.receive("DANCE|");

        assertEquals(List.of("PONG|", "ERROR|Unknown command: DANCE"), p1.sent());
        assertTrue(p1.isOpen());
    }

    @Test
    void quitIsRelayedAndTheSeatFreed() {
        FakeLineChannel[] p = startedGame();

        p[0].receive("QUIT|1");

        assertEquals(List.of("QUIT|1"), p[1].sent());
        assertEquals(DisconnectReason.REMOTE_CLOSED, p[0].closedWith());
        assertEquals(1, room.occupancy());
        assertFalse(room.isStarted());

        FakeLineChannel again = FakeLineChannel.connect(room, "3");
        assertEquals(List.of("PLAYER|1", "SHIPS"), again.sent());
    }

    @Test
    void dropIsRelayedLikeQuit() {
        FakeLineChannel[] p = startedGame();

        p[1].drop();

        assertEquals(List.of("QUIT|2"), p[0].sent());
    }

    @Test
    void roomEmptiesWhenBothLeave() {
        FakeLineChannel[] p = startedGame();

        p[0].drop();
        p[1].drop();

        assertEquals(0, room.occupancy());
        FakeLineChannel fresh = FakeLineChannel.connect(room, "3");
        assertEquals(List.of("PLAYER|1", "WAIT|"), fresh.sent());
    }
}
