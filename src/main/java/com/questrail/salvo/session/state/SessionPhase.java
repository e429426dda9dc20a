package com.questrail.salvo.session.state;

/**
 * Phases of a game session. {@link #GAME_OVER} is terminal.
 */
public enum SessionPhase {
    /** Players place ships; initial phase. */
    SETUP,

    /** Players alternate shots under the turn-ownership rule. */
    GAMEPLAY,

    /** A winner was announced or a player left. */
    GAME_OVER
}
