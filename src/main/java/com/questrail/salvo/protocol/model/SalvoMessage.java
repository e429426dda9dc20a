package com.questrail.salvo.protocol.model;

/**
 * Canonical semantic representation of a Salvo protocol message.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code SalvoMessage} is a closed tagged variant: exactly one record per
 * wire {@code type}, each carrying strongly typed payload fields. It is the
 * ONLY form of message that the session layer (registries, state machine,
 * orchestrator) is permitted to reason about.
 * </p>
 *
 * <p>
 * This interface deliberately abstracts away all wire-level concerns, including:
 * </p>
 * <ul>
 *   <li>JSON field names and casing</li>
 *   <li>Line framing and character encoding</li>
 *   <li>Transport details (TCP, Netty, test doubles)</li>
 * </ul>
 *
 * <p>
 * Those concerns are resolved in the codec layer before a {@code SalvoMessage}
 * instance is created. Decoding a frame yields a value of this variant or a
 * decode exception, never an untyped map.
 * </p>
 */
public sealed interface SalvoMessage
        permits NameRequest, SessionStart, WaitingForOpponent, ErrorMessage,
                SetupComplete, SetupUpdate, GameplayStart, ShipPlacement,
                OpponentShipPlacement, Shot, ReceiveShot, ShotResult, TurnChange,
                OpponentDisconnected, Chat, GameOver, Ping, Pong {

    /**
     * Returns the wire discriminator of this message.
     *
     * @return the message type
     */
    MessageType type();
}
