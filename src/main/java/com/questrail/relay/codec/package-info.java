/**
 * Relay Codec: Wire-Level Rules
 * =============================================================================
 *
 * <p>This package defines the byte-level rules of the client-to-server framed
 * protocol:</p>
 *
 * <pre>
 *   tag:     4 bytes, ASCII command name ("name", "chat", "quit", ...)
 *   len:     4 bytes, unsigned integer, network byte order
 *   payload: exactly len bytes, UTF-8 text, no terminator
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec sits <strong>below</strong> command dispatch and
 * <strong>above</strong> transport I/O:</p>
 *
 * <pre>
 *   StreamConnection bytes
 *        → FrameHeader.decode      (8 header bytes)
 *            → ChatFrame           (tag + payload)
 *                → ChatDispatcher  (name / chat / quit / unknown)
 * </pre>
 *
 * <p>Server-to-client broadcasts do not use this framing: they are plain UTF-8
 * lines terminated by {@code '\n'}.</p>
 */
package com.questrail.relay.codec;
