package com.questrail.salvo.protocol.model;

/**
 * A client announces that its fleet placement is final.
 *
 * <p>{@code playerNum} is informational; the session uses the sender's slot.</p>
 */
public record SetupComplete(int playerNum) implements SalvoMessage {
    @Override
    public MessageType type() {
        return MessageType.SETUP_COMPLETE;
    }
}
