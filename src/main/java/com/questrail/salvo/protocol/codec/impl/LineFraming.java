package com.questrail.salvo.protocol.codec.impl;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * LineFraming
 * -----------------------------------------------------------------------------
 * Framing rules shared by every line-oriented Salvo transport.
 *
 * <ul>
 *   <li>One record per line, terminated by {@code '\n'}</li>
 *   <li>An optional {@code '\r'} before the terminator is tolerated on input</li>
 *   <li>UTF-8 on the wire</li>
 * </ul>
 *
 * <p>The JSON encoder escapes control characters inside strings, so a record
 * can never contain a raw delimiter.</p>
 */
public final class LineFraming
{
    public static final char DELIMITER = '\n';
    public static final Charset CHARSET = StandardCharsets.UTF_8;
    public static final int DEFAULT_MAX_LINE_LENGTH = 8192;

    private LineFraming() {
    }

    /**
     * Append the delimiter to a record.
     *
     * @throws IllegalArgumentException if the record already contains a delimiter
     */
    public static String frame(String record) {
        Objects.requireNonNull(record, "record");
        if (record.indexOf(DELIMITER) >= 0) {
            throw new IllegalArgumentException("record must not contain the line delimiter");
        }
        return record + DELIMITER;
    }

    /**
     * Strip a trailing delimiter and carriage return, if present.
     */
    public static String unframe(String line) {
        Objects.requireNonNull(line, "line");
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == DELIMITER) {
            end--;
        }
        if (end > 0 && line.charAt(end - 1) == '\r') {
            end--;
        }
        return line.substring(0, end);
    }
}
