/**
 * Transport Ports
 * =============================================================================
 *
 * The boundary between a concrete medium (Netty TCP, Netty UDP with an ARQ
 * session, an in-memory pipe) and the connection layer.
 *
 * <p>Everything above this package sees only:</p>
 * <ul>
 *   <li>{@link com.questrail.peerlink.transport.TransportChannel}: one peer
 *       link carrying whole frames as {@code byte[]}</li>
 *   <li>{@link com.questrail.peerlink.transport.TransportListener}: accepted
 *       channels and the end of listening</li>
 *   <li>{@link com.questrail.peerlink.transport.Transport}: listen, dial and
 *       release resources</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Move frames only; no message decoding or handler dispatch</li>
 *   <li>Deliver frames of one channel in order for {@code RELIABLE} sends</li>
 *   <li>Unblock a pending {@code receive()} promptly when the channel closes</li>
 *   <li>Keep framework types (Netty {@code ByteBuf}, {@code Channel}) inside
 *       their own sub-packages</li>
 * </ul>
 *
 * <p>Because the in-memory pipe satisfies the same contract as the socket
 * transports, host mode runs the exact connection, dispatch and authentication
 * code that remote peers do.</p>
 */
package com.questrail.peerlink.transport;
