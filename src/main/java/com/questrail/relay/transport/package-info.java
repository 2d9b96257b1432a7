/**
 * Relay Transport Ports
 * =============================================================================
 *
 * <p>These types define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty, plain NIO, or a test
 * double) and the chat protocol layers above it.</p>
 *
 * <h2>What lives here</h2>
 * <ul>
 *   <li>{@link com.questrail.relay.transport.StreamConnection}: condition-driven
 *       reads and whole-buffer writes on one socket</li>
 *   <li>{@link com.questrail.relay.transport.MatchCondition} and its two concrete
 *       forms, {@link com.questrail.relay.transport.LineCondition} and
 *       {@link com.questrail.relay.transport.ByteCountCondition}</li>
 *   <li>{@link com.questrail.relay.transport.ReadAccumulator}: the read buffer and
 *       pending-read bookkeeping shared by every implementation</li>
 *   <li>{@link com.questrail.relay.transport.StreamAcceptor} and
 *       {@link com.questrail.relay.transport.StreamConnector}: listening and
 *       connecting</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no tag/length decoding, no dispatch)</li>
 *   <li>Deliver all callbacks for one connection on one execution context</li>
 *   <li>Keep framework types (e.g. Netty's {@code ByteBuf}, {@code Channel}) out
 *       of this package's signatures</li>
 * </ul>
 */
package com.questrail.relay.transport;
