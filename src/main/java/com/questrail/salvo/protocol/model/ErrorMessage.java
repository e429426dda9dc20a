package com.questrail.salvo.protocol.model;

import java.util.Objects;

/**
 * Human-readable rejection sent to a single client.
 */
public record ErrorMessage(String message) implements SalvoMessage {
    public ErrorMessage {
        Objects.requireNonNull(message, "message");
    }

    @Override
    public MessageType type() {
        return MessageType.ERROR;
    }
}
