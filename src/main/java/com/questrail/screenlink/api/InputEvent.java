package com.questrail.screenlink.api;

import java.util.Objects;

/**
 * InputEvent
 * -----------------------------------------------------------------------------
 * One controller sample, created by the input-capture collaborator on every
 * state change and discarded once serialized onto the wire.
 *
 * <h2>Value ranges</h2>
 * <ul>
 *   <li>{@link InputKind#BUTTON}: {@code 0.0} (released) or {@code 1.0} (pressed)</li>
 *   <li>{@link InputKind#AXIS}: {@code [-1.0, 1.0]}</li>
 *   <li>{@link InputKind#TOUCHPAD}: a non-negative pixel coordinate while
 *       {@code active}; the code selects the x or y axis</li>
 * </ul>
 *
 * <p>{@code active} is carried by every touchpad event. A released touchpad
 * has no coordinate, so its value is normalized to {@code 0.0}. Buttons and
 * axes are always active.</p>
 */
public record InputEvent(InputKind kind, int code, float value, boolean active)
{
    public InputEvent
    {
        Objects.requireNonNull(kind, "kind");
        if (Float.isNaN(value) || Float.isInfinite(value)) {
            throw new IllegalArgumentException("value must be finite: " + value);
        }

        switch (kind) {
            case BUTTON -> {
                if (value != 0.0f && value != 1.0f) {
                    throw new IllegalArgumentException("button value must be 0 or 1: " + value);
                }
                requireActive(kind, active);
            }
            case AXIS -> {
                if (value < -1.0f || value > 1.0f) {
                    throw new IllegalArgumentException("axis value out of [-1, 1]: " + value);
                }
                requireActive(kind, active);
            }
            case TOUCHPAD -> {
                if (!active) {
                    value = 0.0f;
                }
                else if (value < 0.0f) {
                    throw new IllegalArgumentException("touchpad coordinate must be >= 0: " + value);
                }
            }
        }
    }

    public static InputEvent button(int code, boolean pressed)
    {
        return new InputEvent(InputKind.BUTTON, code, pressed ? 1.0f : 0.0f, true);
    }

    public static InputEvent axis(int code, float value)
    {
        return new InputEvent(InputKind.AXIS, code, value, true);
    }

    public static InputEvent touch(int code, float coordinate)
    {
        return new InputEvent(InputKind.TOUCHPAD, code, coordinate, true);
    }

    public static InputEvent touchReleased(int code)
    {
        return new InputEvent(InputKind.TOUCHPAD, code, 0.0f, false);
    }

    /**
     * Returns a copy of this event with a different value, keeping kind, code
     * and activity.
     */
    public InputEvent withValue(float newValue)
    {
        return new InputEvent(kind, code, newValue, active);
    }

    private static void requireActive(InputKind kind, boolean active)
    {
        if (!active) {
            throw new IllegalArgumentException(kind + " events are always active");
        }
    }
}
