package com.questrail.screenlink.protocol.mirror.internal.bitrate;

import com.questrail.screenlink.protocol.mirror.internal.time.MonotonicClock;

import java.util.Objects;
import java.util.Optional;

/**
 * BitrateController
 * -----------------------------------------------------------------------------
 * Additive-increase / multiplicative-decrease controller for the encoder's
 * target bitrate.
 *
 * <h2>Window classification</h2>
 * <ul>
 *   <li><b>Pressure</b>: at least {@code dropThreshold} frames dropped, any
 *       authentication failure, or a send backlog at or above
 *       {@code backlogThreshold} for {@code backlogWindows} windows in a row.
 *       The target is multiplied by {@code decreaseFactor}.</li>
 *   <li><b>Clean</b>: nothing dropped, no authentication failures, no
 *       backlog. After {@code cleanWindowsBeforeIncrease} clean windows in a
 *       row the target grows by {@code increaseStep}.</li>
 *   <li>Anything else holds the target and breaks the clean streak.</li>
 * </ul>
 *
 * <h2>Gating</h2>
 * The target starts at {@code maxBitrate}, is always clamped to
 * {@code [minBitrate, maxBitrate]}, and changes at most once per
 * {@code evaluationWindow} on the {@link MonotonicClock}. A window that
 * arrives inside the gate still updates the streak counters.
 *
 * <p>Thread-safe.</p>
 */
public final class BitrateController
{
    private final BitratePolicy policy;
    private final MonotonicClock clock;

    private int currentBitrate;
    private int backlogStreak;
    private int cleanStreak;
    private boolean adjusted;
    private long lastAdjustmentNanos;

    public BitrateController(BitratePolicy policy, MonotonicClock clock)
    {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.currentBitrate = policy.maxBitrate();
    }

    /**
     * Folds one window of feedback into the controller.
     *
     * @return the new target if this window changed it
     */
    public synchronized Optional<TargetBitrate> onFeedback(TransportFeedback feedback)
    {
        Objects.requireNonNull(feedback, "feedback");

        final boolean backlogged = feedback.sendBacklog() >= policy.backlogThreshold();
        backlogStreak = backlogged ? backlogStreak + 1 : 0;

        final boolean pressure = feedback.droppedFrames() >= policy.dropThreshold()
                || feedback.authFailures() > 0
                || backlogStreak >= policy.backlogWindows();

        final boolean clean = feedback.droppedFrames() == 0
                && feedback.authFailures() == 0
                && !backlogged;
        cleanStreak = clean ? cleanStreak + 1 : 0;

        final long now = clock.nowNanos();
        if (adjusted && now - lastAdjustmentNanos < policy.evaluationWindow().toNanos()) {
            return Optional.empty();
        }

        final int next;
        if (pressure) {
            next = clamp(Math.round(currentBitrate * policy.decreaseFactor()));
            backlogStreak = 0;
            cleanStreak = 0;
        }
        else if (cleanStreak >= policy.cleanWindowsBeforeIncrease()) {
            next = clamp((long) currentBitrate + policy.increaseStep());
            cleanStreak = 0;
        }
        else {
            return Optional.empty();
        }

        if (next == currentBitrate) {
            return Optional.empty();
        }

        currentBitrate = next;
        adjusted = true;
        lastAdjustmentNanos = now;
        return Optional.of(new TargetBitrate(next));
    }

    public synchronized int currentBitrate()
    {
        return currentBitrate;
    }

    public BitratePolicy policy()
    {
        return policy;
    }

    /** Returns to {@code maxBitrate} and forgets all streaks. */
    public synchronized void reset()
    {
        currentBitrate = policy.maxBitrate();
        backlogStreak = 0;
        cleanStreak = 0;
        adjusted = false;
        lastAdjustmentNanos = 0L;
    }

    private int clamp(long bitrate)
    {
        return (int) Math.max(policy.minBitrate(), Math.min(policy.maxBitrate(), bitrate));
    }
}
