package com.questrail.salvo.protocol.legacy;

import com.questrail.salvo.protocol.codec.MalformedMessageException;

import java.util.Locale;
import java.util.Objects;

/**
 * LegacyPipeCodec
 * -----------------------------------------------------------------------------
 * Text forms of the pipe-delimited room protocol.
 *
 * <p>Each record is one ASCII line; tokens are separated by {@code |} and
 * most records end with a trailing {@code |}. {@code FIRE} is the one command
 * whose arguments are space separated: {@code FIRE 3 4|}.</p>
 *
 * <pre>
 *   server → client   PLAYER|1   WAIT|   SHIPS   START|1   SHOT|1|3|4|hit
 *                     ERROR|Not your turn   PONG|   PING|   QUIT|2
 *   client → server   YOURPLACEMENT|   FIRE 3 4|   PING|   QUIT|1
 * </pre>
 */
public final class LegacyPipeCodec
{
    public static final char SEPARATOR = '|';

    private LegacyPipeCodec() {
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * @throws MalformedMessageException if the line is not a known command
     */
    public static LegacyCommand parse(String line)
    {
        Objects.requireNonNull(line, "line");
        String text = line.strip();
        if (text.isEmpty()) {
            throw new MalformedMessageException("Empty command");
        }

        String[] parts = text.split("\\|", -1);
        String head = parts[0].trim();
        String keyword = head.split("\\s+", 2)[0].toUpperCase(Locale.ROOT);

        switch (keyword) {
            case "YOURPLACEMENT":
                return new LegacyCommand.PlacementDone();
            case "PING":
                return new LegacyCommand.Ping();
            case "QUIT":
                return new LegacyCommand.Quit(parts.length > 1 ? parseInt(parts[1], "player id", 0) : 0);
            case "FIRE":
                return parseFire(head);
            default:
                throw new MalformedMessageException("Unknown command: " + keyword);
        }
    }

    private static LegacyCommand.Fire parseFire(String head)
    {
        String[] tokens = head.split("\\s+");
        if (tokens.length != 3) {
            throw new MalformedMessageException("Usage: FIRE <row> <col>|");
        }
        return new LegacyCommand.Fire(parseInt(tokens[1], "row", null), parseInt(tokens[2], "col", null));
    }

    private static int parseInt(String token, String what, Integer fallback)
    {
        String t = token.trim();
        if (t.isEmpty() && fallback != null) {
            return fallback;
        }
        try {
            return Integer.parseInt(t);
        } catch (NumberFormatException e) {
            throw new MalformedMessageException("Bad " + what + ": '" + token + "'", e);
        }
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    public static String player(int id) {
        return "PLAYER|" + id;
    }

    public static String waitForOpponent() {
        return "WAIT|";
    }

    public static String ships() {
        return "SHIPS";
    }

    public static String start(int turn) {
        return "START|" + turn;
    }

    public static String shot(int player, int row, int col, String result) {
        return "SHOT|" + player + SEPARATOR + row + SEPARATOR + col + SEPARATOR + result;
    }

    public static String error(String reason) {
        return "ERROR|" + reason;
    }

    public static String ping() {
        return "PING|";
    }

    public static String pong() {
        return "PONG|";
    }

    public static String quit(int id) {
        return "QUIT|" + id;
    }
}
