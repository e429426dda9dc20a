package com.questrail.salvo.protocol.codec;

import com.questrail.salvo.protocol.model.SalvoMessage;

/**
 * Record-level encoder for the Salvo line protocol.
 *
 * <p>The returned text never contains the line delimiter; framing is applied
 * by the transport.</p>
 */
public interface SalvoMessageEncoder
{
    String encode(SalvoMessage message);
}
