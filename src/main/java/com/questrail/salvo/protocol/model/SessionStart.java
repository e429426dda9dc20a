package com.questrail.salvo.protocol.model;

import java.util.Objects;

/**
 * Sent to each player of a freshly paired session, before any gameplay message.
 *
 * @param sessionId process-unique session identifier
 * @param playerNum the receiving player's slot (1 or 2)
 * @param opponent  the opponent's display name
 */
public record SessionStart(int sessionId, int playerNum, String opponent) implements SalvoMessage {
    public SessionStart {
        Objects.requireNonNull(opponent, "opponent");
    }

    @Override
    public MessageType type() {
        return MessageType.SESSION_START;
    }
}
