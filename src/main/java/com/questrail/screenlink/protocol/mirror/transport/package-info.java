/**
 * Mirroring Transport Ports
 * =============================================================================
 *
 * These types define the <em>carrier-agnostic transport boundary</em> between a
 * concrete link (Netty TCP socket, Bluetooth RFCOMM, or a test double) and the
 * mirroring session.
 *
 * <h2>Why these ports exist</h2>
 * The session must treat Wi-Fi and Bluetooth identically. Everything above the
 * transport sees only:
 * <ul>
 *   <li>Raw stream chunks as {@code byte[]}</li>
 *   <li>Targets as plain strings</li>
 *   <li>Failures as {@link com.questrail.screenlink.protocol.mirror.transport.TransportException}
 *       carrying an {@link com.questrail.screenlink.api.ErrorKind}</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform carrier I/O only (no frame interpretation)</li>
 *   <li>Not retry connects</li>
 *   <li>Unblock every pending call when closed</li>
 * </ul>
 */
package com.questrail.screenlink.protocol.mirror.transport;
