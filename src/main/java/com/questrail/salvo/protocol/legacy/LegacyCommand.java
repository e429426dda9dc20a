package com.questrail.salvo.protocol.legacy;

/**
 * Client-to-server commands of the pipe-delimited room protocol.
 */
public sealed interface LegacyCommand
        permits LegacyCommand.PlacementDone, LegacyCommand.Fire, LegacyCommand.Ping, LegacyCommand.Quit
{
    /** {@code YOURPLACEMENT|} */
    record PlacementDone() implements LegacyCommand { }

    /** {@code FIRE <row> <col>|} */
    record Fire(int row, int col) implements LegacyCommand { }

    /** {@code PING|} */
    record Ping() implements LegacyCommand { }

    /**
     * {@code QUIT|<id>}; the id is informational, the sender's seat is used.
     */
    record Quit(int playerId) implements LegacyCommand { }
}
