package com.questrail.salvo.protocol.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wire discriminators for {@link SalvoMessage}.
 *
 * <p>The {@link #wireName()} is the value of the {@code type} field in the
 * JSON record.</p>
 */
public enum MessageType {
    NAME("name"),
    SESSION_START("session_start"),
    WAITING_FOR_OPPONENT("waiting_for_opponent"),
    ERROR("error"),
    SETUP_COMPLETE("setup_complete"),
    SETUP_UPDATE("setup_update"),
    GAMEPLAY_START("gameplay_start"),
    SHIP_PLACEMENT("ship_placement"),
    OPPONENT_SHIP_PLACEMENT("opponent_ship_placement"),
    SHOT("shot"),
    RECEIVE_SHOT("receive_shot"),
    SHOT_RESULT("shot_result"),
    TURN_CHANGE("turn_change"),
    OPPONENT_DISCONNECTED("opponent_disconnected"),
    CHAT("chat"),
    GAME_OVER("game_over"),
    PING("ping"),
    PONG("pong");

    private static final Map<String, MessageType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MessageType::wireName, Function.identity()));

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire discriminator.
     *
     * @param wireName the {@code type} field value
     * @return the matching type, or empty if the discriminator is unknown
     */
    public static Optional<MessageType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }
}
