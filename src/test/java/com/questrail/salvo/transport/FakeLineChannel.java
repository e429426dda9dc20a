package com.questrail.salvo.transport;

import com.questrail.salvo.protocol.codec.SalvoMessageDecoder;
import com.questrail.salvo.protocol.model.SalvoMessage;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * FakeLineChannel
 * -----------------------------------------------------------------------------
 * Test-only {@link LineChannel} that stands in for one accepted connection.
 *
 * <p>Outbound lines are stored. When a listener is attached the fake behaves
 * like a transport: {@link #connect} delivers {@code onOpen}, {@link #receive}
 * delivers {@code onLine}, and the first close (local or remote) delivers
 * exactly one {@code onClose}, synchronously.</p>
 *
 * <p>{@link #deferCloseNotification()} makes the fake behave like Netty
 * instead: a close takes effect at once, but {@code onClose} is held back
 * until {@link #deliverClose()}, so lines already read can still arrive.</p>
 */
public final class FakeLineChannel implements LineChannel {

    private static final AtomicInteger PORTS = new AtomicInteger(40000);

    private final String id;
    private final SocketAddress remote;
    private final List<String> sent = new ArrayList<>();
    private LineChannelListener listener;
    private DisconnectReason closedWith;
    private boolean deferClose;
    private boolean closeDelivered;

    public FakeLineChannel(String id) {
        this.id = Objects.requireNonNull(id, "id");
        this.remote = new InetSocketAddress("127.0.0.1", PORTS.getAndIncrement());
    }

    /**
     * Create a channel and announce it to {@code listener}.
     */
    public static FakeLineChannel connect(LineChannelListener listener, String id) {
        FakeLineChannel ch = new FakeLineChannel(id);
        ch.listener = Objects.requireNonNull(listener, "listener");
        listener.onOpen(ch);
        return ch;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public SocketAddress remoteAddress() {
        return remote;
    }

    @Override
    public synchronized void sendLine(String record) {
        Objects.requireNonNull(record, "record");
        if (closedWith == null) {
            sent.add(record);
        }
    }

    @Override
    public void close(DisconnectReason reason) {
        Objects.requireNonNull(reason, "reason");
        boolean defer;
        synchronized (this) {
            if (closedWith != null) {
                return;
            }
            closedWith = reason;
            defer = deferClose;
        }
        if (!defer) {
            notifyClosed();
        }
    }

    private void notifyClosed() {
        DisconnectReason reason;
        synchronized (this) {
            if (closeDelivered || closedWith == null) {
                return;
            }
            closeDelivered = true;
            reason = closedWith;
        }
        if (listener != null) {
            listener.onClose(this, reason, null);
        }
    }

    @Override
    public synchronized boolean isOpen() {
        return closedWith == null;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void receive(String line) {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        listener.onLine(this, line);
    }

    /**
     * Hold back {@code onClose} until {@link #deliverClose()}.
     */
    public synchronized FakeLineChannel deferCloseNotification() {
        deferClose = true;
        return this;
    }

    /**
     * Deliver a held-back {@code onClose}, if the channel has been closed.
     */
    public void deliverClose() {
        notifyClosed();
    }

    public void idle() {
        listener.onIdle(this);
    }

    public void frameError(Throwable cause) {
        listener.onFrameError(this, cause);
    }

    /**
     * The peer went away.
     */
    public void drop() {
        close(DisconnectReason.REMOTE_CLOSED);
    }

    public synchronized DisconnectReason closedWith() {
        return closedWith;
    }

    public synchronized List<String> sent() {
        return new ArrayList<>(sent);
    }

    /**
     * Every outbound line decoded.
     */
    public List<SalvoMessage> sentMessages(SalvoMessageDecoder decoder) {
        List<SalvoMessage> out = new ArrayList<>();
        for (String line : sent()) {
            out.add(decoder.decode(line));
        }
        return out;
    }

    public synchronized void clear() {
        sent.clear();
    }
}
