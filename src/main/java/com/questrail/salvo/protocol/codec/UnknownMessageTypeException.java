package com.questrail.salvo.protocol.codec;

import java.util.Objects;

/**
 * The frame is a well-formed record whose {@code type} is not part of the protocol.
 */
public final class UnknownMessageTypeException extends SalvoDecodeException
{
    private final String typeName;

    public UnknownMessageTypeException(String typeName) {
        super("Unknown message type: " + typeName);
        this.typeName = Objects.requireNonNull(typeName, "typeName");
    }

    public String typeName() {
        return typeName;
    }
}
