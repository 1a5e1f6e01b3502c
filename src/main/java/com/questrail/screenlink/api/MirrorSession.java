package com.questrail.screenlink.api;

/**
 * MirrorSession
 * -----------------------------------------------------------------------------
 * {@code MirrorSession} is the semantic façade over one screen-mirroring link
 * to a single receiver.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Owning the carrier (socket or RFCOMM) for the lifetime of a session</li>
 *   <li>Enforcing that at most one session is active at a time</li>
 *   <li>Encrypting outbound video and authenticating inbound video</li>
 *   <li>Publishing lifecycle and payload events to the caller</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Retrying failed connections (a caller decision)</li>
 *   <li>Capturing, encoding, decoding or rendering video</li>
 *   <li>Discovering or pairing devices</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * All methods are safe to call from any thread and none of them blocks on
 * carrier I/O. Results of asynchronous work (connect outcome, inbound frames,
 * failures) are delivered through {@link #events()}.
 */
public interface MirrorSession
{
    /**
     * Begins connecting to {@code target} over the given carrier.
     *
     * <p>Returns as soon as the session has entered
     * {@link SessionState#CONNECTING}. The outcome is reported through
     * {@link #events()}.</p>
     *
     * @param kind   carrier to use
     * @param target carrier-specific address ({@code host[:port]} for the
     *               socket carrier, a device address for Bluetooth)
     * @return the epoch assigned to the new session
     * @throws SessionAlreadyActiveException if a session is connecting or connected
     */
    long connect(TransportKind kind, String target);

    /**
     * Queues one encoded video frame for encryption and transmission.
     *
     * @return {@code false} if the session is not connected or the outbound
     *         queue is full (the frame is dropped)
     */
    boolean sendVideoFrame(byte[] payload, int flags, long timestampMicros);

    /**
     * Queues one controller sample for transmission.
     *
     * @return {@code false} if the session is not connected or the outbound
     *         queue is full (the sample is dropped)
     */
    boolean sendInputEvent(InputEvent event);

    /**
     * Closes the carrier and returns to {@link SessionState#DISCONNECTED}
     * from any state. Idempotent. Always publishes exactly one
     * {@link SessionEvent.Disconnected}.
     */
    void disconnect();

    /**
     * Explicit acknowledgement of an {@link SessionState#ERROR}; returns the
     * session to {@link SessionState#DISCONNECTED}. Same semantics as
     * {@link #disconnect()}.
     */
    void reset();

    SessionState state();

    default boolean isConnected()
    {
        return state() == SessionState.CONNECTED;
    }

    /**
     * Queue on which the session publishes its events.
     */
    SessionEventQueue events();
}
