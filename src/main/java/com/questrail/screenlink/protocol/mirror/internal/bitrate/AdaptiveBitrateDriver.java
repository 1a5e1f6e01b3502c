package com.questrail.screenlink.protocol.mirror.internal.bitrate;

import com.questrail.screenlink.api.ErrorKind;
import com.questrail.screenlink.protocol.mirror.internal.time.Cancellable;
import com.questrail.screenlink.protocol.mirror.internal.time.MonotonicClock;
import com.questrail.screenlink.protocol.mirror.internal.time.MonotonicScheduler;
import com.questrail.screenlink.protocol.mirror.internal.time.WallClock;
import com.questrail.screenlink.protocol.mirror.observability.BitrateChangeEvent;
import com.questrail.screenlink.protocol.mirror.observability.NullObservabilitySink;
import com.questrail.screenlink.protocol.mirror.observability.SessionErrorEvent;
import com.questrail.screenlink.protocol.mirror.observability.SessionObservabilitySink;

import java.util.Objects;
import java.util.Optional;

/**
 * AdaptiveBitrateDriver
 * =============================================================================
 * Periodic loop that closes the bitrate feedback cycle:
 *
 * <pre>
 *   every evaluationWindow:
 *       FeedbackSource.sampleAndReset()
 *           → BitrateController.onFeedback
 *               → BitrateSink.applyTargetBitrate   (only on change)
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} and {@link #stop()} are idempotent. Ticks run on the
 * scheduler's thread; a failing sink is reported and does not stop the loop.
 */
public final class AdaptiveBitrateDriver
{
    private final BitrateController controller;
    private final FeedbackSource source;
    private final BitrateSink sink;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SessionObservabilitySink observabilitySink;

    private Cancellable ticking;

    public AdaptiveBitrateDriver(BitrateController controller,
                                 FeedbackSource source,
                                 BitrateSink sink,
                                 MonotonicScheduler scheduler,
                                 MonotonicClock clock,
                                 WallClock wallClock,
                                 SessionObservabilitySink observabilitySink)
    {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.source = Objects.requireNonNull(source, "source");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public synchronized void start()
    {
        if (ticking == null) {
            ticking = scheduler.scheduleEvery(controller.policy().evaluationWindow(), clock, this::tick);
        }
    }

    public synchronized void stop()
    {
        if (ticking != null) {
            ticking.cancel();
            ticking = null;
        }
    }

    public synchronized boolean isRunning()
    {
        return ticking != null;
    }

    /**
     * Evaluates one window. Package-private so tests can drive it without a
     * scheduler.
     */
    void tick()
    {
        Optional<TransportFeedback> sample = source.sampleAndReset();
        if (sample.isEmpty()) {
            return;
        }

        final int previous = controller.currentBitrate();
        Optional<TargetBitrate> target = controller.onFeedback(sample.get());
        if (target.isEmpty()) {
            return;
        }

        observabilitySink.onBitrateChange(new BitrateChangeEvent(
                wallClock.now(), previous, target.get().bitsPerSecond(), sample.get()));
        try {
            sink.applyTargetBitrate(target.get());
        }
        catch (RuntimeException e) {
            observabilitySink.onError(new SessionErrorEvent(
                    wallClock.now(), 0L, ErrorKind.IO_ERROR, "Bitrate sink rejected " + target.get(), e));
        }
    }
}
