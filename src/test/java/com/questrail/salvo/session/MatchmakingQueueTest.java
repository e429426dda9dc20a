package com.questrail.salvo.session;

import com.questrail.salvo.observability.NullObservabilitySink;
import com.questrail.salvo.protocol.codec.impl.JsonSalvoMessageCodec;
import com.questrail.salvo.protocol.model.Chat;
import com.questrail.salvo.protocol.model.SessionStart;
import com.questrail.salvo.session.state.SessionStateReducer;
import com.questrail.salvo.session.state.Slot;
import com.questrail.salvo.transport.ConnectionHandle;
import com.questrail.salvo.transport.FakeLineChannel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

final class MatchmakingQueueTest {

    private final JsonSalvoMessageCodec codec = new JsonSalvoMessageCodec();

    private SessionRegistry sessions;
    private MatchmakingQueue queue;
    private PlayerRegistry players;

    @BeforeEach
    void setUp() {
        ReentrantLock lobby = new ReentrantLock();
        sessions = new SessionRegistry(new SessionStateReducer(), NullObservabilitySink.INSTANCE, Clock.systemUTC());
        queue = new MatchmakingQueue(lobby, sessions);
        players = new PlayerRegistry(lobby, queue);
    }

    private Player register(String name) {
        return players.register(name, new ConnectionHandle(new FakeLineChannel(name), codec));
    }

    @Test
    void firstPlayerIsQueued() {
        Player a = register("a");

        Pairing p = queue.enqueueOrPair(a);

        assertFalse(p.isPaired());
        assertTrue(queue.contains(a));
        assertEquals(List.of("a"), queue.waitingNames());
    }

    @Test
    void secondPlayerIsPairedWithTheHeadAsSlotOne() {
        Player a = register("a");
        Player b = register("b");
        queue.enqueueOrPair(a);

        Pairing p = queue.enqueueOrPair(b);

        assertTrue(p.isPaired());
        GameSession s = p.session().orElseThrow();
        assertEquals(1, s.id());
        assertSame(a, s.player(Slot.ONE));
        assertSame(b, s.player(Slot.TWO));
        assertEquals(0, queue.size());
        assertSame(s, a.session().orElseThrow());
        assertSame(s, b.session().orElseThrow());
    }

    @Test
    void pairedPlayersReceiveSessionStartBeforeReturn() {
        FakeLineChannel chA = new FakeLineChannel("a");
        FakeLineChannel chB = new FakeLineChannel("b");
        Player a = players.register("a", new ConnectionHandle(chA, codec));
        Player b = players.register("b", new ConnectionHandle(chB, codec));
        queue.enqueueOrPair(a);

        queue.enqueueOrPair(b);

        assertEquals(List.of(new SessionStart(1, 1, "b")), chA.sentMessages(codec));
        assertEquals(List.of(new SessionStart(1, 2, "a")), chB.sentMessages(codec));
    }

    @Test
    void sessionStartPrecedesAnythingTheWaitingPlayerSendsOnceSeated() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            for (int round = 0; round < 200; round++) {
                // GIVEN a waiting player whose connection sends chat the moment it is seated
                ReentrantLock lobby = new ReentrantLock();
                SessionRegistry registry = new SessionRegistry(
                        new SessionStateReducer(), NullObservabilitySink.INSTANCE, Clock.systemUTC());
                MatchmakingQueue q = new MatchmakingQueue(lobby, registry);
                FakeLineChannel chA = new FakeLineChannel("a");
                FakeLineChannel chB = new FakeLineChannel("b");
                Player a = new Player("a", new ConnectionHandle(chA, codec));
                Player b = new Player("b", new ConnectionHandle(chB, codec));
                q.enqueueOrPair(a);

                CountDownLatch spinning = new CountDownLatch(1);
                Future<?> chatter = pool.submit(() -> {
                    spinning.countDown();
                    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                    while (a.session().isEmpty() && System.nanoTime() < deadline) {
                        Thread.onSpinWait();
                    }
                    a.session().orElseThrow().handle(a, new Chat(null, "hi"));
                });
                assertTrue(spinning.await(5, TimeUnit.SECONDS));

                // WHEN the opponent arrives
                q.enqueueOrPair(b);
                chatter.get(5, TimeUnit.SECONDS);

                // THEN both players hear about the session before the chat
                assertEquals(List.of(new SessionStart(1, 1, "b"), new Chat("a", "hi")), chA.sentMessages(codec),
                        "round " + round);
                assertEquals(List.of(new SessionStart(1, 2, "a"), new Chat("a", "hi")), chB.sentMessages(codec),
                        "round " + round);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void pairingIsFifo() {
        Player a = register("a");
        Player b = register("b");
        Player c = register("c");
        queue.enqueueOrPair(a);

        GameSession s = queue.enqueueOrPair(b).session().orElseThrow();
        Pairing third = queue.enqueueOrPair(c);

        assertSame(a, s.player(Slot.ONE));
        assertFalse(third.isPaired());
        assertEquals(List.of("c"), queue.waitingNames());
    }

    @Test
    void departedPlayerIsNeverPaired() {
        Player a = register("a");
        Player b = register("b");
        queue.enqueueOrPair(a);

        players.unregister(a);
        Pairing p = queue.enqueueOrPair(b);

        assertFalse(p.isPaired());
        assertEquals(List.of("b"), queue.waitingNames());
        assertEquals(0, sessions.size());
        assertThrows(IllegalStateException.class, () -> queue.enqueueOrPair(a));
    }

    @Test
    void queueingTwiceIsRejected() {
        Player a = register("a");
        queue.enqueueOrPair(a);

        assertThrows(IllegalStateException.class, () -> queue.enqueueOrPair(a));
    }

    @Test
    void concurrentArrivalsPairEveryoneExactlyOnce() throws Exception {
        int n = 40;
        List<Player> arrivals = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            arrivals.add(register("p" + i));
        }

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Pairing>> results = new ArrayList<>();
        try {
            for (Player p : arrivals) {
                results.add(pool.submit(() -> {
                    go.await();
                    return queue.enqueueOrPair(p);
                }));
            }
            go.countDown();
            for (Future<Pairing> f : results) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(0, queue.size());
        assertEquals(n / 2, sessions.size());
        List<Player> seated = Collections.synchronizedList(new ArrayList<>());
        for (GameSession s : sessions.activeSessions()) {
            seated.add(s.player(Slot.ONE));
            seated.add(s.player(Slot.TWO));
        }
        assertEquals(n, seated.size());
        assertEquals(n, seated.stream().distinct().count());
    }
}
