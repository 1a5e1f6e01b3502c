package com.questrail.screenlink.protocol.mirror.internal.bitrate;

import com.questrail.screenlink.protocol.mirror.internal.time.SystemWallClock;
import com.questrail.screenlink.protocol.mirror.observability.BitrateChangeEvent;
import com.questrail.screenlink.protocol.mirror.observability.RecordingObservabilitySink;
import com.questrail.screenlink.protocol.mirror.observability.SessionErrorEvent;
import com.questrail.screenlink.protocol.mirror.time.DeterministicScheduler;
import com.questrail.screenlink.protocol.mirror.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class AdaptiveBitrateDriverTest
{
    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final BitrateController controller = new BitrateController(BitratePolicy.defaults(), clock);

    private final Deque<TransportFeedback> samples = new ArrayDeque<>();
    private final List<TargetBitrate> applied = new ArrayList<>();

    private AdaptiveBitrateDriver driver(BitrateSink bitrateSink)
    {
        FeedbackSource source = () -> Optional.ofNullable(samples.poll());
        return new AdaptiveBitrateDriver(controller, source, bitrateSink, scheduler, clock,
                SystemWallClock.INSTANCE, sink);
    }

    @Test
    void pressureWindowLowersEncoderTarget()
    {
        AdaptiveBitrateDriver driver = driver(applied::add);
        driver.start();
        samples.add(feedback(3));

        clock.advanceMillis(1_000);
        scheduler.runDueTasks();

        assertEquals(List.of(new TargetBitrate(10_500_000)), applied);
        BitrateChangeEvent event = sink.eventsOfType(BitrateChangeEvent.class).get(0);
        assertEquals(15_000_000, event.previousBitsPerSecond());
        assertTrue(event.isDecrease());
    }

    @Test
    void noSampleMeansNoChange()
    {
        AdaptiveBitrateDriver driver = driver(applied::add);
        driver.start();

        clock.advanceMillis(3_000);
        scheduler.runDueTasks();

        assertTrue(applied.isEmpty());
        assertEquals(1, scheduler.pendingTasks(), "loop keeps ticking");
    }

    @Test
    void failingSinkIsReportedAndLoopContinues()
    {
        AdaptiveBitrateDriver driver = driver(target -> {
            throw new IllegalStateException("encoder gone");
        });
        driver.start();
        samples.add(feedback(2));

        clock.advanceMillis(1_000);
        scheduler.runDueTasks();

        assertEquals(1, sink.eventsOfType(SessionErrorEvent.class).size());
        assertEquals(1, scheduler.pendingTasks());
    }

    @Test
    void stopCancelsTicking()
    {
        AdaptiveBitrateDriver driver = driver(applied::add);
        driver.start();
        driver.start();
        assertTrue(driver.isRunning());

        driver.stop();
        samples.add(feedback(5));
        clock.advanceMillis(5_000);
        scheduler.runDueTasks();

        assertFalse(driver.isRunning());
        assertTrue(applied.isEmpty());
        assertEquals(0, scheduler.pendingTasks());
    }

    private static TransportFeedback feedback(long dropped)
    {
        return new TransportFeedback(0, dropped, 0, 0L, Duration.ofSeconds(1));
    }
}
