package com.questrail.screenlink.protocol.mirror.internal.input;

import com.questrail.screenlink.api.InputEvent;
import com.questrail.screenlink.api.InputKind;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class InputStateFilterTest
{
    private final InputStateFilter filter = new InputStateFilter(0.1f);

    @Test
    void axisInsideDeadZoneFromRestIsNotEmitted()
    {
        assertTrue(filter.filter(InputEvent.axis(ControllerCodes.AXIS_LEFT_X, 0.05f)).isEmpty());
    }

    @Test
    void axisLeavingDeadZoneIsEmittedOnce()
    {
        InputEvent tilt = InputEvent.axis(ControllerCodes.AXIS_LEFT_Y, 0.6f);
        assertEquals(Optional.of(tilt), filter.filter(tilt));
        assertTrue(filter.filter(tilt).isEmpty());
    }

    @Test
    void axisReturningIntoDeadZoneIsEmittedAsCentred()
    {
        filter.filter(InputEvent.axis(ControllerCodes.AXIS_RIGHT_X, -0.8f));

        Optional<InputEvent> back = filter.filter(InputEvent.axis(ControllerCodes.AXIS_RIGHT_X, -0.04f));
        assertEquals(Optional.of(InputEvent.axis(ControllerCodes.AXIS_RIGHT_X, 0.0f)), back);
    }

    @Test
    void buttonsAreEmittedOnChangeOnly()
    {
        assertTrue(filter.filter(InputEvent.button(ControllerCodes.BUTTON_CROSS, false)).isEmpty());
        assertTrue(filter.filter(InputEvent.button(ControllerCodes.BUTTON_CROSS, true)).isPresent());
        assertTrue(filter.filter(InputEvent.button(ControllerCodes.BUTTON_CROSS, true)).isEmpty());
        assertTrue(filter.filter(InputEvent.button(ControllerCodes.BUTTON_CROSS, false)).isPresent());
    }

    @Test
    void controlsAreTrackedIndependently()
    {
        filter.filter(InputEvent.button(ControllerCodes.BUTTON_CROSS, true));
        assertTrue(filter.filter(InputEvent.button(ControllerCodes.BUTTON_CIRCLE, true)).isPresent());
        assertTrue(filter.filter(InputEvent.touch(ControllerCodes.TOUCHPAD_X, 0.0f)).isPresent(),
                "touchpad code 0 is not axis code 0");
    }

    @Test
    void touchpadReleaseIsEmittedAfterTouch()
    {
        assertTrue(filter.filter(InputEvent.touchReleased(ControllerCodes.TOUCHPAD_Y)).isEmpty());
        assertTrue(filter.filter(InputEvent.touch(ControllerCodes.TOUCHPAD_Y, 300f)).isPresent());
        assertEquals(Optional.of(InputEvent.touchReleased(ControllerCodes.TOUCHPAD_Y)),
                filter.filter(InputEvent.touchReleased(ControllerCodes.TOUCHPAD_Y)));
    }

    @Test
    void invalidateLetsUnchangedSampleThrough()
    {
        InputEvent pressed = InputEvent.button(ControllerCodes.BUTTON_R1, true);
        filter.filter(pressed);

        filter.invalidate(InputKind.BUTTON, ControllerCodes.BUTTON_R1);
        assertEquals(Optional.of(pressed), filter.filter(pressed));
    }

    @Test
    void thresholdMustBeBelowOne()
    {
        assertThrows(IllegalArgumentException.class, () -> new InputStateFilter(1.0f));
        assertThrows(IllegalArgumentException.class, () -> new InputStateFilter(-0.1f));
    }

    @Test
    void controllerCodesHaveNames()
    {
        assertEquals("Cross", ControllerCodes.buttonName(ControllerCodes.BUTTON_CROSS));
    }
}
