package com.questrail.screenlink.protocol.mirror.internal.input;

import com.questrail.screenlink.api.InputEvent;
import com.questrail.screenlink.api.InputKind;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * InputStateFilter
 * -----------------------------------------------------------------------------
 * Noise and duplicate suppression for controller samples.
 *
 * <ul>
 *   <li>Axis values whose magnitude is below the dead-zone threshold become
 *       {@code 0.0}.</li>
 *   <li>The last value sent for each (kind, code) is remembered; a sample
 *       equal to it is not emitted.</li>
 * </ul>
 *
 * <p>Every control starts at rest: buttons released, axes centred, touchpad
 * not touched. A sample that merely restates the resting state is therefore
 * not emitted.</p>
 */
public final class InputStateFilter
{
    public static final float DEFAULT_DEAD_ZONE = 0.1f;

    private final float deadZoneThreshold;
    private final Map<Key, InputEvent> lastEmitted = new HashMap<>();

    public InputStateFilter()
    {
        this(DEFAULT_DEAD_ZONE);
    }

    public InputStateFilter(float deadZoneThreshold)
    {
        if (!(deadZoneThreshold >= 0.0f && deadZoneThreshold < 1.0f)) {
            throw new IllegalArgumentException("deadZoneThreshold must be in [0, 1): " + deadZoneThreshold);
        }
        this.deadZoneThreshold = deadZoneThreshold;
    }

    /**
     * @return the sample to transmit, or empty if it does not change what the
     *         peer already has
     */
    public synchronized Optional<InputEvent> filter(InputEvent event)
    {
        Objects.requireNonNull(event, "event");

        InputEvent filtered = event.kind() == InputKind.AXIS
                ? event.withValue(applyDeadZone(event.value()))
                : event;

        Key key = new Key(filtered.kind(), filtered.code());
        InputEvent previous = lastEmitted.getOrDefault(key, resting(key));
        if (previous.equals(filtered)) {
            return Optional.empty();
        }

        lastEmitted.put(key, filtered);
        return Optional.of(filtered);
    }

    /**
     * Forgets the last value for one control, so its next sample is emitted
     * even if unchanged.
     */
    public synchronized void invalidate(InputKind kind, int code)
    {
        lastEmitted.remove(new Key(kind, code));
    }

    /** Forgets every control. */
    public synchronized void clear()
    {
        lastEmitted.clear();
    }

    public float deadZoneThreshold()
    {
        return deadZoneThreshold;
    }

    float applyDeadZone(float value)
    {
        return Math.abs(value) < deadZoneThreshold ? 0.0f : value;
    }

    private static InputEvent resting(Key key)
    {
        return switch (key.kind()) {
            case BUTTON -> InputEvent.button(key.code(), false);
            case AXIS -> InputEvent.axis(key.code(), 0.0f);
            case TOUCHPAD -> InputEvent.touchReleased(key.code());
        };
    }

    private record Key(InputKind kind, int code) {}
}
