/**
 * Mirroring Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> of the mirroring
 * protocol: the byte-exact rules that let video and input share one stream.</p>
 *
 * <h2>Wire format</h2>
 * All multi-byte fields are big-endian.
 * <pre>
 *   Video: [0x01][u32 size][u32 flags][i64 timestampMicros][12 B nonce][size-12 B ciphertext+tag]
 *   Input: [0x02][u8 nameLen][nameLen B ASCII kind][i32 code][f32 value]
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   Transport.receive() chunks
 *        → MirrorFrameDecoder        (tags, lengths, bounds applied here)
 *            → MirrorFrame           (structure validated, video still sealed)
 *                → session receive loop
 *                    → CryptoEngine / event queue
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The codec never decrypts and never sees plaintext video.</li>
 *   <li>Malformed bytes are discarded and reported as a value, never thrown.</li>
 *   <li>A length field above the configured bound is rejected before any
 *       payload is buffered.</li>
 * </ul>
 */
package com.questrail.screenlink.protocol.mirror.codec;
