package com.questrail.salvo.protocol.codec;

import com.questrail.salvo.protocol.model.NameRequest;
import com.questrail.salvo.protocol.model.SalvoMessage;

/**
 * SalvoMessageDecoder
 * -----------------------------------------------------------------------------
 * Record-level decoder for the Salvo line protocol.
 *
 * <p>The decoder is invoked with exactly one frame: the text of a single line,
 * already split off the byte stream and stripped of its delimiter by the
 * transport. It is responsible only for:</p>
 * <ul>
 *   <li>Parsing the structured record</li>
 *   <li>Resolving the {@code type} discriminator</li>
 *   <li>Constructing the strongly typed message on success</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for deciding whether a
 * failure skips the frame or terminates the connection.</p>
 */
public interface SalvoMessageDecoder
{
    /**
     * Decode one frame.
     *
     * @param line a single frame without its delimiter
     * @return the decoded message
     * @throws MalformedMessageException   if the frame is not a valid record
     * @throws UnknownMessageTypeException if the record's type is unknown
     */
    SalvoMessage decode(String line);

    /**
     * Decode the first frame of a connection.
     *
     * <p>The handshake record may omit its {@code type}; when present it must
     * be {@code "name"}.</p>
     *
     * @param line a single frame without its delimiter
     * @return the handshake request
     * @throws MalformedMessageException if the frame is not a name record
     */
    NameRequest decodeHandshake(String line);
}
