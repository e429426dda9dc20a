/**
 * Salvo Codec: transport line codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> of the Salvo
 * protocol: one structured record per line.</p>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec layer sits <strong>below</strong> the session layer and
 * <strong>above</strong> transport I/O:</p>
 *
 * <pre>
 *   byte stream
 *        → line framing          (transport, newline delimited, UTF-8)
 *            → SalvoMessageDecoder
 *                → SalvoMessage  (closed tagged variant)
 *                    → server orchestrator / game session
 * </pre>
 *
 * <h2>Failure Policy</h2>
 * <p>Decoders report failures as {@link com.questrail.salvo.protocol.codec.SalvoDecodeException}
 * subtypes. With newline framing a bad frame never breaks alignment of the
 * stream, so the orchestrator skips bad frames after the handshake and
 * terminates the connection only when the handshake itself is malformed.</p>
 */
package com.questrail.salvo.protocol.codec;
