package com.questrail.salvo.protocol.model;

import java.util.Objects;

/**
 * Free text chat line.
 *
 * <p>Inbound, {@code player} is whatever the client supplied (possibly
 * {@code null}); outbound, the server always stamps the sender's display name.</p>
 */
public record Chat(String player, String text) implements SalvoMessage {
    public Chat {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public MessageType type() {
        return MessageType.CHAT;
    }
}
