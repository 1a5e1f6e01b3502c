package com.questrail.screenlink.protocol.mirror.internal.bitrate;

import com.questrail.screenlink.protocol.mirror.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class BitrateControllerTest
{
    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final BitrateController controller = new BitrateController(BitratePolicy.defaults(), clock);

    @Test
    void startsAtMaximum()
    {
        assertEquals(15_000_000, controller.currentBitrate());
    }

    @Test
    void droppedFramesCutTargetMultiplicatively()
    {
        assertEquals(Optional.of(new TargetBitrate(10_500_000)), controller.onFeedback(window(0, 2, 0)));
        assertEquals(10_500_000, controller.currentBitrate());
    }

    @Test
    void atMostOneAdjustmentPerWindow()
    {
        controller.onFeedback(window(0, 5, 0));

        clock.advanceMillis(999);
        assertTrue(controller.onFeedback(window(0, 5, 0)).isEmpty());

        clock.advanceMillis(1);
        assertEquals(7_350_000, controller.onFeedback(window(0, 5, 0)).orElseThrow().bitsPerSecond());
    }

    @Test
    void singleDropHoldsTarget()
    {
        assertTrue(controller.onFeedback(window(0, 1, 0)).isEmpty());
        assertEquals(15_000_000, controller.currentBitrate());
    }

    @Test
    void anyAuthFailureIsPressure()
    {
        assertEquals(10_500_000, controller.onFeedback(window(0, 0, 1)).orElseThrow().bitsPerSecond());
    }

    @Test
    void backlogMustPersistForTwoWindows()
    {
        assertTrue(controller.onFeedback(window(8, 0, 0)).isEmpty());
        clock.advanceMillis(1_000);
        assertEquals(10_500_000, controller.onFeedback(window(8, 0, 0)).orElseThrow().bitsPerSecond());
    }

    @Test
    void interruptedBacklogDoesNotCount()
    {
        controller.onFeedback(window(9, 0, 0));
        clock.advanceMillis(1_000);
        controller.onFeedback(window(0, 0, 0));
        clock.advanceMillis(1_000);
        assertTrue(controller.onFeedback(window(9, 0, 0)).isEmpty());
    }

    @Test
    void recoversAdditivelyAfterCleanWindows()
    {
        controller.onFeedback(window(0, 3, 0));
        assertEquals(10_500_000, controller.currentBitrate());

        for (int i = 0; i < 2; i++) {
            clock.advanceMillis(1_000);
            assertTrue(controller.onFeedback(window(0, 0, 0)).isEmpty());
        }
        clock.advanceMillis(1_000);
        assertEquals(11_000_000, controller.onFeedback(window(0, 0, 0)).orElseThrow().bitsPerSecond());
    }

    @Test
    void neverLeavesConfiguredRange()
    {
        BitrateController narrow = new BitrateController(BitratePolicy.builder()
                .withMinBitrate(2_000_000)
                .withMaxBitrate(2_500_000)
                .build(), clock);

        assertEquals(2_000_000, narrow.onFeedback(window(0, 10, 0)).orElseThrow().bitsPerSecond());
        clock.advanceMillis(1_000);
        assertTrue(narrow.onFeedback(window(0, 10, 0)).isEmpty(), "already at minimum");

        for (int i = 0; i < 3; i++) {
            clock.advanceMillis(1_000);
            narrow.onFeedback(window(0, 0, 0));
        }
        assertEquals(2_500_000, narrow.currentBitrate());

        for (int i = 0; i < 3; i++) {
            clock.advanceMillis(1_000);
            assertTrue(narrow.onFeedback(window(0, 0, 0)).isEmpty(), "already at maximum");
        }
    }

    @Test
    void resetReturnsToMaximum()
    {
        controller.onFeedback(window(0, 2, 0));
        controller.reset();

        assertEquals(15_000_000, controller.currentBitrate());
        assertTrue(controller.onFeedback(window(0, 2, 0)).isPresent(), "gate cleared");
    }

    @Test
    void policyRejectsInvertedRange()
    {
        assertThrows(IllegalArgumentException.class, () -> BitratePolicy.builder()
                .withMinBitrate(5_000_000)
                .withMaxBitrate(4_000_000)
                .build());
    }

    private static TransportFeedback window(int backlog, long dropped, int authFailures)
    {
        return new TransportFeedback(backlog, dropped, authFailures, 0L, Duration.ofSeconds(1));
    }
}
