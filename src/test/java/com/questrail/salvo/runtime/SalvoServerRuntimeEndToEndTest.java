package com.questrail.salvo.runtime;

import com.questrail.salvo.client.SalvoClient;
import com.questrail.salvo.config.ServerConfig;
import com.questrail.salvo.observability.RecordingObservabilitySink;
import com.questrail.salvo.protocol.codec.impl.JsonSalvoMessageCodec;
import com.questrail.salvo.protocol.model.ErrorMessage;
import com.questrail.salvo.protocol.model.GameOver;
import com.questrail.salvo.protocol.model.GameplayStart;
import com.questrail.salvo.protocol.model.OpponentDisconnected;
import com.questrail.salvo.protocol.model.OpponentShipPlacement;
import com.questrail.salvo.protocol.model.Ping;
import com.questrail.salvo.protocol.model.Pong;
import com.questrail.salvo.protocol.model.RawJson;
import com.questrail.salvo.protocol.model.ReceiveShot;
import com.questrail.salvo.protocol.model.SessionStart;
import com.questrail.salvo.protocol.model.SetupComplete;
import com.questrail.salvo.protocol.model.SetupUpdate;
import com.questrail.salvo.protocol.model.ShipPlacement;
import com.questrail.salvo.protocol.model.Shot;
import com.questrail.salvo.protocol.model.ShotOutcome;
import com.questrail.salvo.protocol.model.ShotResult;
import com.questrail.salvo.protocol.model.TurnChange;
import com.questrail.salvo.protocol.model.WaitingForOpponent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SalvoServerRuntimeEndToEndTest
 * -----------------------------------------------------------------------------
 * Full stack over loopback TCP: Netty endpoint, codec, orchestrator, sessions.
 */
final class SalvoServerRuntimeEndToEndTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final List<SalvoClient> clients = new ArrayList<>();
    private SalvoServerRuntime runtime;

    @AfterEach
    void tearDown() {
        for (SalvoClient c : clients) {
            c.close();
        }
        if (runtime != null) {
            runtime.stop();
        }
    }

    private SalvoServerRuntime start(ServerConfig config) {
        runtime = SalvoServerRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new RecordingObservabilitySink())
                .withLegacyRandom(new Random(1))
                .build();
        runtime.start();
        return runtime;
    }

    private static ServerConfig.Builder loopback() {
        return ServerConfig.builder()
                .withHost("127.0.0.1")
                .withPort(0)
                .withHeartbeatInterval(Duration.ZERO);
    }

    private SalvoClient client(boolean autoPong) {
        SalvoClient c = SalvoClient.connect(runtime.localAddress(), autoPong);
        clients.add(c);
        return c;
    }

    // Server-side bookkeeping finishes on the event loop after the client observes the effect.
    private static boolean eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }

    private SalvoClient join(String name) throws Exception {
        SalvoClient c = client(true);
        c.hello(name);
        return c;
    }

    @Test
    void twoClientsPlayAGameToTheEnd() throws Exception {
        start(loopback().build());

        SalvoClient a = join("A");
        assertEquals(new WaitingForOpponent(), a.next(WAIT));
        SalvoClient b = join("B");

        assertEquals(new SessionStart(1, 1, "B"), a.next(WAIT));
        assertEquals(new SessionStart(1, 2, "A"), b.next(WAIT));

        RawJson ship = new RawJson("{\"name\":\"destroyer\",\"cells\":[[0,0],[0,1]]}");
        a.send(new ShipPlacement(1, ship));
        assertEquals(new OpponentShipPlacement(ship), b.next(WAIT));

        a.send(new SetupComplete(1));
        assertEquals(new SetupUpdate(1, true), a.next(WAIT));
        assertEquals(new SetupUpdate(1, true), b.next(WAIT));
        b.send(new SetupComplete(2));
        assertEquals(new SetupUpdate(2, true), a.next(WAIT));
        assertEquals(new GameplayStart(1), a.next(WAIT));
        assertEquals(new SetupUpdate(2, true), b.next(WAIT));
        assertEquals(new GameplayStart(1), b.next(WAIT));

        a.send(new Shot(1, 3, 4));
        assertEquals(new ReceiveShot(3, 4, 1), b.next(WAIT));
        b.send(new ShotResult(1, 3, 4, ShotOutcome.HIT));
        assertEquals(new ShotResult(1, 3, 4, ShotOutcome.HIT), a.next(WAIT));
        assertEquals(new ShotResult(1, 3, 4, ShotOutcome.HIT), b.next(WAIT));

        a.send(new Shot(1, 5, 5));
        assertEquals(new ReceiveShot(5, 5, 1), b.next(WAIT));
        b.send(new ShotResult(1, 5, 5, ShotOutcome.MISS));
        assertEquals(new ShotResult(1, 5, 5, ShotOutcome.MISS), a.next(WAIT));
        assertEquals(new TurnChange(2), a.next(WAIT));
        assertEquals(new ShotResult(1, 5, 5, ShotOutcome.MISS), b.next(WAIT));
        assertEquals(new TurnChange(2), b.next(WAIT));

        a.send(new Shot(1, 0, 0));
        assertEquals(new ErrorMessage("Not your turn"), a.next(WAIT));

        b.send(new GameOver(2));
        assertEquals(new GameOver(2), a.next(WAIT));
        assertEquals(new GameOver(2), b.next(WAIT));
        assertTrue(eventually(() -> runtime.server().sessions().size() == 0));
    }

    @Test
    void duplicateNameIsRefusedAndDisconnected() throws Exception {
        start(loopback().build());
        SalvoClient first = join("A");
        assertEquals(new WaitingForOpponent(), first.next(WAIT));

        SalvoClient second = join("A");

        assertEquals(new ErrorMessage("Name already taken"), second.next(WAIT));
        assertTrue(second.awaitClosed(WAIT));
        assertTrue(first.isConnected());
    }

    @Test
    void nameSentInTheSameWriteAsARejectedHandshakeIsNotRegistered() throws Exception {
        start(loopback().build());
        SalvoClient a = join("A");
        assertEquals(new WaitingForOpponent(), a.next(WAIT));
        InetSocketAddress addr = runtime.localAddress();

        try (Socket raw = new Socket(addr.getAddress(), addr.getPort())) {
            raw.setSoTimeout(5000);
            OutputStream out = raw.getOutputStream();
            out.write("garbage\n{\"name\":\"X\"}\n".getBytes(StandardCharsets.UTF_8));
            out.flush();

            BufferedReader in = reader(raw);
            assertEquals(new ErrorMessage("Expected name message"), new JsonSalvoMessageCodec().decode(in.readLine()));
        }

        assertTrue(a.isQuiet(Duration.ofMillis(300)));
        assertTrue(a.isConnected());
        assertEquals(List.of("A"), runtime.server().queue().waitingNames());
        assertTrue(runtime.server().players().lookup("X").isEmpty());
    }

    @Test
    void opponentIsToldWhenAPlayerDrops() throws Exception {
        start(loopback().build());
        SalvoClient a = join("A");
        a.next(WAIT);
        SalvoClient b = join("B");
        a.next(WAIT);
        b.next(WAIT);

        a.close();

        assertEquals(new OpponentDisconnected(), b.next(WAIT));
        assertTrue(b.isConnected());
    }

    @Test
    void malformedLineIsSkippedAndTheConnectionSurvives() throws Exception {
        start(loopback().build());
        SalvoClient a = join("A");
        a.next(WAIT);

        a.sendRaw("{this is not json");
        a.send(new Ping());

        assertEquals(new Pong(), a.next(WAIT));
        assertTrue(a.isConnected());
    }

    @Test
    void idleClientIsPingedThenDroppedWhenSilent() throws Exception {
        start(loopback()
                .withHeartbeatInterval(Duration.ofMillis(150))
                .withLivenessTimeout(Duration.ofMillis(900))
                .build());
        SalvoClient a = client(false);
        a.hello("A");
        assertEquals(new WaitingForOpponent(), a.next(WAIT));

        assertEquals(new Ping(), a.next(WAIT));
        assertTrue(a.awaitClosed(WAIT));
        assertTrue(eventually(() -> runtime.server().players().size() == 0));
    }

    @Test
    void clientAnsweringPingsStaysConnected() throws Exception {
        start(loopback()
                .withHeartbeatInterval(Duration.ofMillis(100))
                .withLivenessTimeout(Duration.ofMillis(600))
                .build());
        SalvoClient a = join("A");
        assertEquals(new WaitingForOpponent(), a.next(WAIT));

        Thread.sleep(1500);

        assertTrue(a.isConnected());
        assertEquals(1, runtime.server().players().size());
    }

    @Test
    void stopClosesEveryConnection() throws Exception {
        start(loopback().build());
        SalvoClient a = join("A");
        a.next(WAIT);

        runtime.stop();
        runtime = null;

        assertTrue(a.awaitClosed(WAIT));
    }

    @Test
    void legacyRoomRunsBesideTheJsonEndpoint() throws Exception {
        start(loopback().withLegacyPort(0).build());
        InetSocketAddress legacy = runtime.legacyAddress();
        assertNotNull(legacy);

        try (Socket s1 = new Socket(legacy.getAddress(), legacy.getPort())) {
            s1.setSoTimeout(5000);
            BufferedReader in1 = reader(s1);
            assertEquals("PLAYER|1", in1.readLine());
            assertEquals("WAIT|", in1.readLine());

            try (Socket s2 = new Socket(legacy.getAddress(), legacy.getPort())) {
                s2.setSoTimeout(5000);
                BufferedReader in2 = reader(s2);
                assertEquals("PLAYER|2", in2.readLine());
                assertEquals("SHIPS", in2.readLine());
                assertEquals("SHIPS", in1.readLine());

                OutputStream out1 = s1.getOutputStream();
                out1.write("PING|\n".getBytes(StandardCharsets.US_ASCII));
                out1.flush();
                assertEquals("PONG|", in1.readLine());
            }

            assertEquals("QUIT|2", in1.readLine());
        }
    }

    private static BufferedReader reader(Socket socket) throws IOException {
        return new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
    }
}
