package com.questrail.screenlink.protocol.mirror.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly to timestamp session events and
 * observability records.
 *
 * <p>This clock may jump. It MUST NOT drive bitrate windows or sampling.</p>
 */
public interface WallClock
{
    Instant now();
}
