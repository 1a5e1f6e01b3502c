/**
 * Mirroring Codec: Stream Implementation
 * =============================================================================
 *
 * <p>Concrete codec that bridges carrier byte chunks and
 * {@link com.questrail.screenlink.protocol.mirror.model.MirrorFrame} values.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] chunk (any size, any boundary)
 *        → DefaultMirrorFrameDecoder.append
 *        → DefaultMirrorFrameDecoder.decodeNext
 *        → EncryptedVideoFrame | InputFrame
 * </pre>
 *
 * <p>This codec layer is strictly:</p>
 * <ul>
 *   <li>carrier-agnostic</li>
 *   <li>crypto-agnostic</li>
 *   <li>bounded in memory</li>
 * </ul>
 *
 * <p>Any failure at this layer results in the offending bytes being dropped.</p>
 */
package com.questrail.screenlink.protocol.mirror.codec.impl;
