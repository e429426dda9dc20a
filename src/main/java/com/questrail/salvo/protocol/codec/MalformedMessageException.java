package com.questrail.salvo.protocol.codec;

/**
 * The frame is not a well-formed message record.
 *
 * This typically reflects:
 * <ul>
 *   <li>Text that is not a JSON object</li>
 *   <li>A missing or ill-typed required field</li>
 *   <li>An unknown shot outcome</li>
 * </ul>
 */
public final class MalformedMessageException extends SalvoDecodeException
{
    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
