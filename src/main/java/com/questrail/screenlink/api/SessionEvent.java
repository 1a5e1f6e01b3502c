package com.questrail.screenlink.api;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionEvent
 * -----------------------------------------------------------------------------
 * Typed notifications emitted by the session onto its event queue.
 *
 * <h2>Delivery model</h2>
 * The session never calls into caller code from its receive, send or connect
 * workers. Every observable fact is published as an immutable event and the
 * caller drains the queue on its own thread. Within one session, video events
 * are queued in wire order and input events are queued in wire order; the two
 * streams may interleave arbitrarily.
 *
 * <h2>Epochs</h2>
 * Each connect attempt opens a new epoch. Events carry the epoch that produced
 * them so callers can discard stragglers from a session they already consider
 * finished.
 */
public sealed interface SessionEvent
        permits SessionEvent.StateChanged,
                SessionEvent.Connected,
                SessionEvent.Disconnected,
                SessionEvent.DataReceived,
                SessionEvent.Error
{
    Instant timestamp();

    long epoch();

    /**
     * The session moved between lifecycle states.
     *
     * @param cause human-readable cause for failure transitions; {@code null}
     *              for ordinary transitions
     */
    record StateChanged(Instant timestamp, long epoch, SessionState from, SessionState to, String cause)
            implements SessionEvent
    {
        public StateChanged
        {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    /** The carrier handshake succeeded and the receive loop is running. */
    record Connected(Instant timestamp, long epoch, TransportKind transportKind) implements SessionEvent
    {
        public Connected
        {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(transportKind, "transportKind");
        }
    }

    /**
     * The session reached {@link SessionState#DISCONNECTED}. Emitted once per
     * {@code disconnect()} call even when nothing was connected, and once when
     * the peer closes the stream.
     */
    record Disconnected(Instant timestamp, long epoch, String reason) implements SessionEvent
    {
        public Disconnected
        {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(reason, "reason");
        }
    }

    /** Marker for inbound payload events. */
    sealed interface DataReceived extends SessionEvent
            permits VideoReceived, InputReceived
    {
    }

    /** A video frame arrived and was authenticated and decrypted. */
    record VideoReceived(Instant timestamp, long epoch, VideoFrame frame) implements DataReceived
    {
        public VideoReceived
        {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(frame, "frame");
        }
    }

    /** A controller sample arrived from the peer. */
    record InputReceived(Instant timestamp, long epoch, InputEvent input) implements DataReceived
    {
        public InputReceived
        {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(input, "input");
        }
    }

    /**
     * A fatal fault ended the session. Exactly one is emitted per failed
     * session.
     */
    record Error(Instant timestamp, long epoch, ErrorKind kind, String cause) implements SessionEvent
    {
        public Error
        {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(cause, "cause");
        }
    }
}
