package com.questrail.screenlink.protocol.mirror;

import com.questrail.screenlink.api.ErrorKind;
import com.questrail.screenlink.api.InputEvent;
import com.questrail.screenlink.api.MirrorSession;
import com.questrail.screenlink.api.SessionAlreadyActiveException;
import com.questrail.screenlink.api.SessionEvent;
import com.questrail.screenlink.api.SessionEventQueue;
import com.questrail.screenlink.api.SessionState;
import com.questrail.screenlink.api.TransportKind;
import com.questrail.screenlink.api.VideoFrame;
import com.questrail.screenlink.protocol.mirror.codec.DecodeResult;
import com.questrail.screenlink.protocol.mirror.codec.MirrorFrameDecoder;
import com.questrail.screenlink.protocol.mirror.codec.MirrorFrameEncoder;
import com.questrail.screenlink.protocol.mirror.codec.impl.DefaultMirrorFrameDecoder;
import com.questrail.screenlink.protocol.mirror.codec.impl.DefaultMirrorFrameEncoder;
import com.questrail.screenlink.protocol.mirror.config.SessionPolicy;
import com.questrail.screenlink.protocol.mirror.crypto.AuthFailedException;
import com.questrail.screenlink.protocol.mirror.crypto.CryptoEngine;
import com.questrail.screenlink.protocol.mirror.crypto.SealedPayload;
import com.questrail.screenlink.protocol.mirror.internal.bitrate.FeedbackSource;
import com.questrail.screenlink.protocol.mirror.internal.bitrate.TransportFeedback;
import com.questrail.screenlink.protocol.mirror.internal.session.SessionSnapshot;
import com.questrail.screenlink.protocol.mirror.internal.time.MonotonicClock;
import com.questrail.screenlink.protocol.mirror.internal.time.SystemMonotonicClock;
import com.questrail.screenlink.protocol.mirror.internal.time.SystemWallClock;
import com.questrail.screenlink.protocol.mirror.internal.time.WallClock;
import com.questrail.screenlink.protocol.mirror.model.EncryptedVideoFrame;
import com.questrail.screenlink.protocol.mirror.model.InputFrame;
import com.questrail.screenlink.protocol.mirror.model.MirrorFrame;
import com.questrail.screenlink.protocol.mirror.observability.FrameDropEvent;
import com.questrail.screenlink.protocol.mirror.observability.NullObservabilitySink;
import com.questrail.screenlink.protocol.mirror.observability.SessionErrorEvent;
import com.questrail.screenlink.protocol.mirror.observability.SessionObservabilitySink;
import com.questrail.screenlink.protocol.mirror.observability.SessionStateTransitionEvent;
import com.questrail.screenlink.protocol.mirror.observability.TransportObservabilityEvent;
import com.questrail.screenlink.protocol.mirror.transport.Transport;
import com.questrail.screenlink.protocol.mirror.transport.TransportException;
import com.questrail.screenlink.protocol.mirror.transport.TransportFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * MirrorSessionController
 * =============================================================================
 * Production implementation of {@link MirrorSession}.
 *
 * <h2>State discipline</h2>
 * The lifecycle lives in one {@link AtomicReference} to an immutable
 * {@link SessionSnapshot}. Every transition is a compare-and-set from the
 * snapshot the writer observed; a writer that loses re-reads and re-decides.
 * Two racing {@code connect()} calls therefore cannot both leave
 * {@code DISCONNECTED}: one CAS wins, the other observes an active snapshot
 * and is rejected.
 *
 * <p>The CAS and the publication of the events it implies happen under
 * {@code publishLock}, so the event queue always reflects transitions in the
 * order they were committed.</p>
 *
 * <h2>Threads per session</h2>
 * <pre>
 *   caller ── connect() ──► CONNECTING ──► connect worker ── Transport.connect
 *                                             │ success            │ failure
 *                                             ▼                    ▼
 *                                        CONNECTED               ERROR
 *                                             │
 *               receive loop ◄────────────────┤──────────► sender worker
 *        receive → decode → decrypt → event   │     encrypt → encode → send
 * </pre>
 *
 * <h2>Epochs</h2>
 * Each accepted connect increments the epoch. Workers carry the epoch they
 * were started for and may only transition a snapshot of the same epoch, so a
 * straggler from a finished session can never end a newer one. The first
 * worker to end a session commits the terminal transition; later failures of
 * the same session are ignored, which yields exactly one terminal
 * notification.
 */
public final class MirrorSessionController implements MirrorSession, FeedbackSource
{
    private static final String DISCONNECT_REQUESTED = "disconnect requested";
    private static final String RESET_REQUESTED = "reset requested";

    private final TransportFactory transports;
    private final CryptoEngine crypto;
    private final MirrorFrameEncoder encoder;
    private final SessionPolicy policy;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SessionObservabilitySink observabilitySink;

    private final SessionEventQueue events = new SessionEventQueue();
    private final AtomicReference<SessionSnapshot> snapshot = new AtomicReference<>(SessionSnapshot.initial());
    private final Object publishLock = new Object();

    /** Link of the current epoch; written only together with a committed transition. */
    private volatile SessionLink link;

    private MirrorSessionController(Builder b)
    {
        this.transports = Objects.requireNonNull(b.transports, "transports");
        this.crypto = Objects.requireNonNull(b.crypto, "crypto");
        this.encoder = Objects.requireNonNull(b.encoder, "encoder");
        this.policy = Objects.requireNonNull(b.policy, "policy");
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(b.observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    // -------------------------------------------------------------------------
    // MirrorSession
    // -------------------------------------------------------------------------

    @Override
    public long connect(TransportKind kind, String target)
    {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(target, "target");
        if (!transports.supports(kind)) {
            throw new IllegalArgumentException("No transport registered for " + kind);
        }

        SessionSnapshot current = snapshot.get();
        while (true) {
            if (current.isActive()) {
                throw new SessionAlreadyActiveException(current.state());
            }

            SessionSnapshot next = current.connecting(kind, target);
            SessionLink opened = new SessionLink(next.epoch(), kind, target, newDecoder(),
                    policy.sendQueueCapacity(), clock.nowNanos());

            Commit commit = commit(current, next, opened, List.of(stateChanged(current, next, null)));
            if (commit.committed()) {
                if (commit.previous() != null) {
                    commit.previous().close();
                }
                observeTransition(current, next, null);

                Thread worker = new Thread(() -> runConnect(opened), "screenlink-connect-" + next.epoch());
                worker.setDaemon(true);
                worker.start();
                return next.epoch();
            }

            opened.close();
            current = snapshot.get();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Ownership of {@code payload} passes to the session; the caller must
     * not modify it afterwards.</p>
     *
     * @throws IllegalArgumentException if {@code payload} is longer than
     *         {@link SessionPolicy#maxVideoPlaintext()}, or if
     *         {@code timestampMicros} is lower than the previous video
     *         timestamp of this session
     */
    @Override
    public boolean sendVideoFrame(byte[] payload, int flags, long timestampMicros)
    {
        Objects.requireNonNull(payload, "payload");
        if (payload.length > policy.maxVideoPlaintext()) {
            throw new IllegalArgumentException("video payload of " + payload.length
                    + " bytes exceeds " + policy.maxVideoPlaintext() + " bytes");
        }
        SessionLink l = connectedLink();
        if (l == null) {
            return false;
        }

        l.checkVideoTimestamp(timestampMicros);
        return submit(l, () -> sendVideo(l, payload, flags, timestampMicros), "video");
    }

    @Override
    public boolean sendInputEvent(InputEvent event)
    {
        Objects.requireNonNull(event, "event");
        SessionLink l = connectedLink();
        if (l == null) {
            return false;
        }

        return submit(l, () -> sendInput(l, event), "input");
    }

    @Override
    public void disconnect()
    {
        endByCaller(DISCONNECT_REQUESTED);
    }

    @Override
    public void reset()
    {
        endByCaller(RESET_REQUESTED);
    }

    @Override
    public SessionState state()
    {
        return snapshot.get().state();
    }

    @Override
    public SessionEventQueue events()
    {
        return events;
    }

    /** Current lifecycle snapshot, including epoch and failure cause. */
    public SessionSnapshot snapshot()
    {
        return snapshot.get();
    }

    // -------------------------------------------------------------------------
    // FeedbackSource
    // -------------------------------------------------------------------------

    @Override
    public Optional<TransportFeedback> sampleAndReset()
    {
        SessionLink l = connectedLink();
        if (l == null) {
            return Optional.empty();
        }

        long now = clock.nowNanos();
        Duration window = Duration.ofNanos(Math.max(0L, now - l.restartFeedbackWindow(now)));
        return Optional.of(l.counters().sampleAndReset(l.sendBacklog(), window));
    }

    // -------------------------------------------------------------------------
    // Connect worker
    // -------------------------------------------------------------------------

    private void runConnect(SessionLink l)
    {
        final Transport transport;
        try {
            transport = transports.create(l.kind());
        }
        catch (RuntimeException e) {
            fail(l, ErrorKind.IO_ERROR, "unable to create " + l.kind() + " transport: " + describe(e), e);
            return;
        }

        if (!l.attach(transport)) {
            // Disconnected before the carrier existed.
            transport.close();
            return;
        }

        observeTransport(l, "connecting");
        try {
            transport.connect(l.target());
        }
        catch (TransportException e) {
            fail(l, e.kind(), e.getMessage(), e);
            return;
        }
        catch (RuntimeException e) {
            fail(l, ErrorKind.IO_ERROR, "connect failed: " + describe(e), e);
            return;
        }

        SessionSnapshot current = snapshot.get();
        while (current.epoch() == l.epoch() && current.state() == SessionState.CONNECTING) {
            SessionSnapshot next = current.connected();
            Commit commit = commit(current, next, l, List.of(
                    stateChanged(current, next, null),
                    new SessionEvent.Connected(wallClock.now(), l.epoch(), l.kind())));
            if (commit.committed()) {
                observeTransition(current, next, null);
                observeTransport(l, "connected");

                Thread receiver = new Thread(() -> runReceive(l), "screenlink-receive-" + l.epoch());
                receiver.setDaemon(true);
                receiver.start();
                return;
            }
            current = snapshot.get();
        }

        // The session ended while the carrier was connecting.
        l.close();
    }

    // -------------------------------------------------------------------------
    // Receive loop
    // -------------------------------------------------------------------------

    private void runReceive(SessionLink l)
    {
        final Transport transport = l.transport();
        final MirrorFrameDecoder decoder = l.decoder();
        int consecutiveAuthFailures = 0;

        try {
            while (!l.isClosed()) {
                decoder.append(transport.receive());

                DecodeResult result;
                while ((result = decoder.decodeNext()) != DecodeResult.NeedMoreData.INSTANCE) {
                    if (l.isClosed()) {
                        return;
                    }

                    if (result instanceof DecodeResult.Malformed malformed) {
                        observabilitySink.onFrameDropped(new FrameDropEvent(
                                wallClock.now(), l.epoch(), FrameDropEvent.Reason.MALFORMED, malformed.reason()));
                        continue;
                    }

                    MirrorFrame frame = ((DecodeResult.Decoded) result).frame();
                    if (frame instanceof InputFrame input) {
                        if (!publishData(l, new SessionEvent.InputReceived(wallClock.now(), l.epoch(), input.event()))) {
                            return;
                        }
                        continue;
                    }

                    EncryptedVideoFrame video = (EncryptedVideoFrame) frame;
                    try {
                        byte[] plaintext = crypto.decrypt(video.sealedPayload());
                        consecutiveAuthFailures = 0;
                        if (!publishData(l, new SessionEvent.VideoReceived(wallClock.now(), l.epoch(),
                                new VideoFrame(plaintext, video.flags(), video.timestampMicros())))) {
                            return;
                        }
                    }
                    catch (AuthFailedException e) {
                        consecutiveAuthFailures++;
                        l.counters().recordAuthFailure();
                        observabilitySink.onFrameDropped(new FrameDropEvent(
                                wallClock.now(), l.epoch(), FrameDropEvent.Reason.AUTH_FAILED,
                                e.getMessage() + " (" + consecutiveAuthFailures + " consecutive)"));

                        if (consecutiveAuthFailures >= policy.maxConsecutiveAuthFailures()) {
                            fail(l, ErrorKind.AUTH_FAILED, consecutiveAuthFailures
                                    + " consecutive video frames failed authentication", e);
                            return;
                        }
                    }
                }
            }
        }
        catch (TransportException e) {
            if (e.kind() == ErrorKind.PEER_CLOSED) {
                endByPeer(l, e.getMessage());
            }
            else {
                fail(l, e.kind(), e.getMessage(), e);
            }
        }
        catch (RuntimeException e) {
            fail(l, ErrorKind.IO_ERROR, "receive loop failed: " + describe(e), e);
        }
    }

    // -------------------------------------------------------------------------
    // Sender worker tasks
    // -------------------------------------------------------------------------

    private boolean submit(SessionLink l, Runnable task, String what)
    {
        try {
            l.sender().execute(task);
            return true;
        }
        catch (RejectedExecutionException e) {
            if (l.isClosed()) {
                return false;
            }
            l.counters().recordDroppedFrame();
            observabilitySink.onFrameDropped(new FrameDropEvent(
                    wallClock.now(), l.epoch(), FrameDropEvent.Reason.QUEUE_FULL,
                    what + " frame dropped, " + policy.sendQueueCapacity() + " frames already queued"));
            return false;
        }
    }

    private void sendVideo(SessionLink l, byte[] payload, int flags, long timestampMicros)
    {
        try {
            SealedPayload sealed = crypto.encrypt(payload);
            byte[] wire = encoder.encodeVideoFrame(sealed.toWire(), flags, timestampMicros);
            l.transport().send(wire);
            l.counters().recordBytesSent(wire.length);
        }
        catch (TransportException e) {
            fail(l, e.kind(), "video send failed: " + e.getMessage(), e);
        }
        catch (RuntimeException e) {
            fail(l, ErrorKind.IO_ERROR, "video send failed: " + describe(e), e);
        }
    }

    private void sendInput(SessionLink l, InputEvent event)
    {
        try {
            byte[] wire = encoder.encodeInputEvent(event);
            l.transport().send(wire);
            l.counters().recordBytesSent(wire.length);
        }
        catch (TransportException e) {
            fail(l, e.kind(), "input send failed: " + e.getMessage(), e);
        }
        catch (RuntimeException e) {
            fail(l, ErrorKind.IO_ERROR, "input send failed: " + describe(e), e);
        }
    }

    // -------------------------------------------------------------------------
    // Terminal transitions
    // -------------------------------------------------------------------------

    /**
     * Moves the session of {@code l} to ERROR unless it already ended.
     */
    private void fail(SessionLink l, ErrorKind kind, String cause, Throwable error)
    {
        SessionSnapshot current = snapshot.get();
        while (current.isCurrent(l.epoch())) {
            SessionSnapshot next = current.failed(cause);
            Commit commit = commit(current, next, null, List.of(
                    stateChanged(current, next, cause),
                    new SessionEvent.Error(wallClock.now(), l.epoch(), kind, cause)));
            if (commit.committed()) {
                l.close();
                observeTransition(current, next, cause);
                observabilitySink.onError(new SessionErrorEvent(wallClock.now(), l.epoch(), kind, cause, error));
                return;
            }
            current = snapshot.get();
        }

        // Stale worker: the session already ended and reported once.
        l.close();
    }

    /**
     * Moves the session of {@code l} to DISCONNECTED after an orderly close by
     * the peer.
     */
    private void endByPeer(SessionLink l, String reason)
    {
        SessionSnapshot current = snapshot.get();
        while (current.isCurrent(l.epoch())) {
            SessionSnapshot next = current.disconnected();
            Commit commit = commit(current, next, null, List.of(
                    stateChanged(current, next, reason),
                    new SessionEvent.Disconnected(wallClock.now(), l.epoch(), reason)));
            if (commit.committed()) {
                l.close();
                observeTransition(current, next, reason);
                observeTransport(l, "closed by peer");
                return;
            }
            current = snapshot.get();
        }

        l.close();
    }

    private void endByCaller(String reason)
    {
        while (true) {
            SessionSnapshot current = snapshot.get();
            SessionSnapshot next = current.disconnected();

            List<SessionEvent> published = new ArrayList<>(2);
            if (current.state() != SessionState.DISCONNECTED) {
                published.add(stateChanged(current, next, null));
            }
            published.add(new SessionEvent.Disconnected(wallClock.now(), current.epoch(), reason));

            Commit commit = commit(current, next, null, published);
            if (commit.committed()) {
                SessionLink previous = commit.previous();
                if (previous != null) {
                    previous.close();
                    observeTransport(previous, "closed: " + reason);
                }
                if (current.state() != SessionState.DISCONNECTED) {
                    observeTransition(current, next, null);
                }
                return;
            }
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    /**
     * Compare-and-set of the snapshot, publishing {@code published} and
     * installing {@code nextLink} only if the CAS succeeds.
     */
    private Commit commit(SessionSnapshot expected,
                          SessionSnapshot next,
                          SessionLink nextLink,
                          List<SessionEvent> published)
    {
        synchronized (publishLock) {
            if (!snapshot.compareAndSet(expected, next)) {
                return Commit.LOST;
            }

            SessionLink previous = link;
            link = nextLink;
            for (SessionEvent event : published) {
                events.publish(event);
            }
            return new Commit(true, previous == nextLink ? null : previous);
        }
    }

    /**
     * Publishes inbound data of {@code l} only while its session is still
     * connected. The check and the publication share {@code publishLock}
     * with {@link #commit}, so no data event follows the session's terminal
     * event.
     *
     * @return {@code false} if the session of {@code l} has ended
     */
    private boolean publishData(SessionLink l, SessionEvent.DataReceived event)
    {
        synchronized (publishLock) {
            SessionSnapshot s = snapshot.get();
            if (s.epoch() != l.epoch() || s.state() != SessionState.CONNECTED) {
                return false;
            }
            events.publish(event);
            return true;
        }
    }

    private SessionLink connectedLink()
    {
        SessionSnapshot s = snapshot.get();
        if (s.state() != SessionState.CONNECTED) {
            return null;
        }
        SessionLink l = link;
        return (l != null && l.epoch() == s.epoch()) ? l : null;
    }

    private MirrorFrameDecoder newDecoder()
    {
        return new DefaultMirrorFrameDecoder(policy.maxVideoPayload());
    }

    private SessionEvent.StateChanged stateChanged(SessionSnapshot from, SessionSnapshot to, String cause)
    {
        return new SessionEvent.StateChanged(wallClock.now(), to.epoch(), from.state(), to.state(), cause);
    }

    private void observeTransition(SessionSnapshot from, SessionSnapshot to, String cause)
    {
        observabilitySink.onStateTransition(new SessionStateTransitionEvent(
                wallClock.now(), to.epoch(), from.state(), to.state(), cause));
    }

    private void observeTransport(SessionLink l, String description)
    {
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), l.epoch(), l.kind(), l.target(), description));
    }

    private static String describe(Throwable t)
    {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private record Commit(boolean committed, SessionLink previous)
    {
        static final Commit LOST = new Commit(false, null);
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder
    {
        private TransportFactory transports;
        private CryptoEngine crypto;
        private MirrorFrameEncoder encoder = new DefaultMirrorFrameEncoder();
        private SessionPolicy policy = SessionPolicy.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private SessionObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        private Builder() {}

        public Builder transports(TransportFactory transports)
        {
            this.transports = transports;
            return this;
        }

        public Builder crypto(CryptoEngine crypto)
        {
            this.crypto = crypto;
            return this;
        }

        public Builder encoder(MirrorFrameEncoder encoder)
        {
            this.encoder = encoder;
            return this;
        }

        public Builder policy(SessionPolicy policy)
        {
            this.policy = policy;
            return this;
        }

        public Builder clock(MonotonicClock clock)
        {
            this.clock = clock;
            return this;
        }

        public Builder wallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public Builder observabilitySink(SessionObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public MirrorSessionController build()
        {
            return new MirrorSessionController(this);
        }
    }
}
