/**
 * Salvo Transport Ports
 * =============================================================================
 *
 * These types define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, a test double)
 * and the Salvo server.
 *
 * <h2>Why these ports exist</h2>
 * Netty carries the production transport (event loop model, line framing,
 * idle detection, write buffering) <strong>without</strong> allowing Netty
 * types to leak into the session layer. Everything above the transport sees only:
 * <ul>
 *   <li>Records as {@code String} lines, delimiter removed</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Lifecycle notifications (open, idle, close with a {@link com.questrail.salvo.transport.DisconnectReason})</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no protocol interpretation)</li>
 *   <li>Never originate protocol messages (heartbeat probes are sent by the server on {@code onIdle})</li>
 *   <li>Deliver callbacks for one channel sequentially</li>
 * </ul>
 */
package com.questrail.salvo.transport;
