package com.questrail.screenlink.protocol.mirror.internal.bitrate;

import java.time.Duration;
import java.util.Objects;

/**
 * BitratePolicy
 * -----------------------------------------------------------------------------
 * Tuning for the additive-increase / multiplicative-decrease controller.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>minBitrate / maxBitrate</b>: clamp range in bits per second. The
 *       controller starts at {@code maxBitrate}.</li>
 *   <li><b>decreaseFactor</b>: multiplier applied under pressure (0.7).</li>
 *   <li><b>increaseStep</b>: bits per second added after sustained clean
 *       delivery (500 kbps).</li>
 *   <li><b>evaluationWindow</b>: feedback window; at most one adjustment is
 *       emitted per window (1 s).</li>
 *   <li><b>dropThreshold</b>: dropped frames in one window that count as
 *       pressure (2).</li>
 *   <li><b>backlogThreshold / backlogWindows</b>: queued frames that count as
 *       backlog, and how many consecutive backlogged windows count as
 *       pressure (8, 2).</li>
 *   <li><b>cleanWindowsBeforeIncrease</b>: consecutive clean windows required
 *       before an increase (3).</li>
 * </ul>
 */
public record BitratePolicy(
        int minBitrate,
        int maxBitrate,
        double decreaseFactor,
        int increaseStep,
        Duration evaluationWindow,
        int dropThreshold,
        int backlogThreshold,
        int backlogWindows,
        int cleanWindowsBeforeIncrease
) {
    public static final int DEFAULT_MAX_BITRATE = 15_000_000;
    public static final int DEFAULT_MIN_BITRATE = 1_000_000;

    public BitratePolicy {
        Objects.requireNonNull(evaluationWindow, "evaluationWindow");

        if (minBitrate <= 0) {
            throw new IllegalArgumentException("minBitrate must be positive");
        }
        if (maxBitrate < minBitrate) {
            throw new IllegalArgumentException("maxBitrate must be >= minBitrate");
        }
        if (!(decreaseFactor > 0.0 && decreaseFactor < 1.0)) {
            throw new IllegalArgumentException("decreaseFactor must be in (0, 1): " + decreaseFactor);
        }
        if (increaseStep <= 0) {
            throw new IllegalArgumentException("increaseStep must be positive");
        }
        if (evaluationWindow.isNegative() || evaluationWindow.isZero()) {
            throw new IllegalArgumentException("evaluationWindow must be positive");
        }
        if (dropThreshold < 1 || backlogThreshold < 1 || backlogWindows < 1 || cleanWindowsBeforeIncrease < 1) {
            throw new IllegalArgumentException("thresholds must be >= 1");
        }
    }

    public static BitratePolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int minBitrate = DEFAULT_MIN_BITRATE;
        private int maxBitrate = DEFAULT_MAX_BITRATE;
        private double decreaseFactor = 0.7;
        private int increaseStep = 500_000;
        private Duration evaluationWindow = Duration.ofSeconds(1);
        private int dropThreshold = 2;
        private int backlogThreshold = 8;
        private int backlogWindows = 2;
        private int cleanWindowsBeforeIncrease = 3;

        public Builder withMinBitrate(int minBitrate) {
            this.minBitrate = minBitrate;
            return this;
        }

        public Builder withMaxBitrate(int maxBitrate) {
            this.maxBitrate = maxBitrate;
            return this;
        }

        public Builder withDecreaseFactor(double decreaseFactor) {
            this.decreaseFactor = decreaseFactor;
            return this;
        }

        public Builder withIncreaseStep(int increaseStep) {
            this.increaseStep = increaseStep;
            return this;
        }

        public Builder withEvaluationWindow(Duration evaluationWindow) {
            this.evaluationWindow = evaluationWindow;
            return this;
        }

        public Builder withDropThreshold(int dropThreshold) {
            this.dropThreshold = dropThreshold;
            return this;
        }

        public Builder withBacklogThreshold(int backlogThreshold) {
            this.backlogThreshold = backlogThreshold;
            return this;
        }

        public Builder withBacklogWindows(int backlogWindows) {
            this.backlogWindows = backlogWindows;
            return this;
        }

        public Builder withCleanWindowsBeforeIncrease(int windows) {
            this.cleanWindowsBeforeIncrease = windows;
            return this;
        }

        public BitratePolicy build() {
            return new BitratePolicy(minBitrate, maxBitrate, decreaseFactor, increaseStep, evaluationWindow,
                    dropThreshold, backlogThreshold, backlogWindows, cleanWindowsBeforeIncrease);
        }
    }
}
