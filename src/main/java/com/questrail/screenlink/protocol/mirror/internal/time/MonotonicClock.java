package com.questrail.screenlink.protocol.mirror.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational decision in the mirroring core: bitrate
 * evaluation windows, feedback sampling cadence and adjustment gating.
 *
 * <h2>Binding invariant</h2>
 * Operational timing MUST use this clock. Wall-clock time is permitted only
 * for event timestamps (see {@link WallClock}).
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
