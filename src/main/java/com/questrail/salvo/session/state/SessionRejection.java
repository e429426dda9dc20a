package com.questrail.salvo.session.state;

/**
 * Reasons the reducer refuses a message without changing state.
 *
 * <p>Rejections never fault the connection. Those with a
 * {@link #clientMessage()} are reported to the sender as an {@code error}.</p>
 */
public enum SessionRejection {
    OUT_OF_TURN("Not your turn"),
    SHOT_PENDING("Awaiting result of previous shot"),
    NOT_SHOT_TARGET("Only the targeted player may report a shot result"),
    NO_PENDING_SHOT("No shot is awaiting a result"),
    RESULT_MISMATCH("Shot result does not match the pending shot"),
    WRONG_PHASE("Message not allowed in the current phase"),
    INVALID_WINNER("Winner must be player 1 or 2"),
    UNEXPECTED_MESSAGE(null);

    private final String clientMessage;

    SessionRejection(String clientMessage) {
        this.clientMessage = clientMessage;
    }

    /**
     * Text sent back to the sender, or {@code null} if the rejection is silent.
     */
    public String clientMessage() {
        return clientMessage;
    }
}
