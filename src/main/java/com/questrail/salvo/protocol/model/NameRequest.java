package com.questrail.salvo.protocol.model;

import java.util.Objects;

/**
 * Handshake request carrying the player's display name.
 *
 * <p>This is the only message a client may send before it is registered.
 * On the wire the {@code type} field may be omitted for this message.</p>
 */
public record NameRequest(String name) implements SalvoMessage {
    public NameRequest {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public MessageType type() {
        return MessageType.NAME;
    }
}
