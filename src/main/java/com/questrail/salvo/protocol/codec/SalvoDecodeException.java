package com.questrail.salvo.protocol.codec;

/**
 * Indicates that a framed line could not be translated into a valid
 * {@link com.questrail.salvo.protocol.model.SalvoMessage}.
 *
 * <p>Callers decide what a decode failure means for the connection. The
 * codec itself never drops input silently.</p>
 */
public class SalvoDecodeException extends RuntimeException
{
    public SalvoDecodeException(String message) {
        super(message);
    }

    public SalvoDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
