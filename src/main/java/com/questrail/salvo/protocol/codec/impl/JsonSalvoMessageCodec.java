package com.questrail.salvo.protocol.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.salvo.protocol.codec.MalformedMessageException;
import com.questrail.salvo.protocol.codec.SalvoMessageDecoder;
import com.questrail.salvo.protocol.codec.SalvoMessageEncoder;
import com.questrail.salvo.protocol.codec.UnknownMessageTypeException;
import com.questrail.salvo.protocol.model.Chat;
import com.questrail.salvo.protocol.model.ErrorMessage;
import com.questrail.salvo.protocol.model.GameOver;
import com.questrail.salvo.protocol.model.GameplayStart;
import com.questrail.salvo.protocol.model.MessageType;
import com.questrail.salvo.protocol.model.NameRequest;
import com.questrail.salvo.protocol.model.OpponentDisconnected;
import com.questrail.salvo.protocol.model.OpponentShipPlacement;
import com.questrail.salvo.protocol.model.Ping;
import com.questrail.salvo.protocol.model.Pong;
import com.questrail.salvo.protocol.model.RawJson;
import com.questrail.salvo.protocol.model.ReceiveShot;
import com.questrail.salvo.protocol.model.SalvoMessage;
import com.questrail.salvo.protocol.model.SessionStart;
import com.questrail.salvo.protocol.model.SetupComplete;
import com.questrail.salvo.protocol.model.SetupUpdate;
import com.questrail.salvo.protocol.model.ShipPlacement;
import com.questrail.salvo.protocol.model.Shot;
import com.questrail.salvo.protocol.model.ShotOutcome;
import com.questrail.salvo.protocol.model.ShotResult;
import com.questrail.salvo.protocol.model.TurnChange;
import com.questrail.salvo.protocol.model.WaitingForOpponent;

import java.util.Objects;

/**
 * JsonSalvoMessageCodec
 * =============================================================================
 * Jackson-backed implementation of the Salvo record codec.
 *
 * <h2>Wire shape</h2>
 * Every record is a compact JSON object with a {@code type} discriminator and
 * snake_case payload fields, for example:
 *
 * <pre>
 *   {"type":"shot","player_num":1,"row":3,"col":4}
 *   {"type":"shot_result","player":1,"row":3,"col":4,"result":"hit"}
 * </pre>
 *
 * <h2>Jackson containment rule</h2>
 * Jackson types (e.g. {@code JsonNode}, {@code ObjectMapper}) MUST NOT escape
 * this package. Opaque payloads such as ship placements cross the boundary as
 * {@link RawJson} text.
 *
 * <h2>Thread Safety</h2>
 * Instances are immutable after construction and may be shared by all
 * connections.
 */
public final class JsonSalvoMessageCodec implements SalvoMessageDecoder, SalvoMessageEncoder
{
    private static final String TYPE = "type";

    private final ObjectMapper mapper;
    // One record per line: anything after the closing brace makes the line malformed.
    private final ObjectReader recordReader;

    public JsonSalvoMessageCodec() {
        this(new ObjectMapper());
    }

    public JsonSalvoMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.recordReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    // -------------------------------------------------------------------------
    // Decoding
    // -------------------------------------------------------------------------

    @Override
    public SalvoMessage decode(String line) {
        JsonNode node = parseObject(line);

        JsonNode typeNode = node.get(TYPE);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new MalformedMessageException("Missing or non-text 'type' field");
        }
        String typeName = typeNode.asText();
        MessageType type = MessageType.fromWireName(typeName)
                .orElseThrow(() -> new UnknownMessageTypeException(typeName));

        return switch (type) {
            case NAME -> new NameRequest(requireText(node, "name"));
            case SESSION_START -> new SessionStart(
                    requireInt(node, "session_id"),
                    requireInt(node, "player_num"),
                    requireText(node, "opponent"));
            case WAITING_FOR_OPPONENT -> new WaitingForOpponent();
            case ERROR -> new ErrorMessage(requireText(node, "message"));
            case SETUP_COMPLETE -> new SetupComplete(requireInt(node, "player_num"));
            case SETUP_UPDATE -> new SetupUpdate(
                    requireInt(node, "player"),
                    requireBoolean(node, "ready"));
            case GAMEPLAY_START -> new GameplayStart(requireInt(node, "current_player"));
            case SHIP_PLACEMENT -> new ShipPlacement(
                    requireInt(node, "player_num"),
                    requireRaw(node, "ship"));
            case OPPONENT_SHIP_PLACEMENT -> new OpponentShipPlacement(requireRaw(node, "ship"));
            case SHOT -> new Shot(
                    requireInt(node, "player_num"),
                    requireInt(node, "row"),
                    requireInt(node, "col"));
            case RECEIVE_SHOT -> new ReceiveShot(
                    requireInt(node, "row"),
                    requireInt(node, "col"),
                    requireInt(node, "player"));
            case SHOT_RESULT -> new ShotResult(
                    requireInt(node, "player"),
                    requireInt(node, "row"),
                    requireInt(node, "col"),
                    requireOutcome(node, "result"));
            case TURN_CHANGE -> new TurnChange(requireInt(node, "current_player"));
            case OPPONENT_DISCONNECTED -> new OpponentDisconnected();
            case CHAT -> new Chat(optionalText(node, "player"), requireText(node, "text"));
            case GAME_OVER -> new GameOver(requireInt(node, "winner"));
            case PING -> new Ping();
            case PONG -> new Pong();
        };
    }

    @Override
    public NameRequest decodeHandshake(String line) {
        JsonNode node = parseObject(line);

        // Legacy clients send {"name": ...} without a discriminator.
        JsonNode typeNode = node.get(TYPE);
        if (typeNode != null && !MessageType.NAME.wireName().equals(typeNode.asText())) {
            throw new MalformedMessageException("Expected a name record, got type '" + typeNode.asText() + "'");
        }
        return new NameRequest(requireText(node, "name"));
    }

    private JsonNode parseObject(String line) {
        Objects.requireNonNull(line, "line");
        final JsonNode node;
        try {
            node = recordReader.readTree(LineFraming.unframe(line));
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Unparsable record: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedMessageException("Record is not a JSON object");
        }
        return node;
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new MalformedMessageException("Missing or non-text field '" + field + "'");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new MalformedMessageException("Non-text field '" + field + "'");
        }
        return value.asText();
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new MalformedMessageException("Missing or non-integer field '" + field + "'");
        }
        return value.intValue();
    }

    private static boolean requireBoolean(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isBoolean()) {
            throw new MalformedMessageException("Missing or non-boolean field '" + field + "'");
        }
        return value.booleanValue();
    }

    private static ShotOutcome requireOutcome(JsonNode node, String field) {
        String text = requireText(node, field);
        return ShotOutcome.fromWireName(text)
                .orElseThrow(() -> new MalformedMessageException("Unknown shot outcome '" + text + "'"));
    }

    private RawJson requireRaw(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new MalformedMessageException("Missing field '" + field + "'");
        }
        try {
            return new RawJson(mapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Unserializable field '" + field + "'", e);
        }
    }

    // -------------------------------------------------------------------------
    // Encoding
    // -------------------------------------------------------------------------

    @Override
    public String encode(SalvoMessage message) {
        Objects.requireNonNull(message, "message");

        ObjectNode node = mapper.createObjectNode();
        node.put(TYPE, message.type().wireName());

        if (message instanceof NameRequest m) {
            node.put("name", m.name());
        } else if (message instanceof SessionStart m) {
            node.put("session_id", m.sessionId());
            node.put("player_num", m.playerNum());
            node.put("opponent", m.opponent());
        } else if (message instanceof ErrorMessage m) {
            node.put("message", m.message());
        } else if (message instanceof SetupComplete m) {
            node.put("player_num", m.playerNum());
        } else if (message instanceof SetupUpdate m) {
            node.put("player", m.player());
            node.put("ready", m.ready());
        } else if (message instanceof GameplayStart m) {
            node.put("current_player", m.currentPlayer());
        } else if (message instanceof ShipPlacement m) {
            node.put("player_num", m.playerNum());
            node.set("ship", readRaw(m.ship()));
        } else if (message instanceof OpponentShipPlacement m) {
            node.set("ship", readRaw(m.ship()));
        } else if (message instanceof Shot m) {
            node.put("player_num", m.playerNum());
            node.put("row", m.row());
            node.put("col", m.col());
        } else if (message instanceof ReceiveShot m) {
            node.put("row", m.row());
            node.put("col", m.col());
            node.put("player", m.player());
        } else if (message instanceof ShotResult m) {
            node.put("player", m.player());
            node.put("row", m.row());
            node.put("col", m.col());
            node.put("result", m.result().wireName());
        } else if (message instanceof TurnChange m) {
            node.put("current_player", m.currentPlayer());
        } else if (message instanceof Chat m) {
            if (m.player() != null) {
                node.put("player", m.player());
            }
            node.put("text", m.text());
        } else if (message instanceof GameOver m) {
            node.put("winner", m.winner());
        }
        // WaitingForOpponent, OpponentDisconnected, Ping and Pong carry no payload.

        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.type(), e);
        }
    }

    private JsonNode readRaw(RawJson raw) {
        try {
            return mapper.readTree(raw.json());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Opaque payload is not valid JSON: " + raw.json(), e);
        }
    }
}
