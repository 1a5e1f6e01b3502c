package com.questrail.screenlink.protocol.mirror.internal.input;

/**
 * ControllerCodes
 * -----------------------------------------------------------------------------
 * Codes carried in {@link com.questrail.screenlink.api.InputEvent#code()} for
 * a PlayStation (DualShock 4 / DualSense) controller.
 *
 * <p>Button codes are Android {@code KeyEvent} key codes and axis codes are
 * Android {@code MotionEvent} axis identifiers, so the receiver can replay
 * them without translation.</p>
 */
public final class ControllerCodes
{
    public static final int BUTTON_CROSS = 96;
    public static final int BUTTON_CIRCLE = 97;
    public static final int BUTTON_SQUARE = 99;
    public static final int BUTTON_TRIANGLE = 100;
    public static final int BUTTON_L1 = 102;
    public static final int BUTTON_R1 = 103;
    public static final int BUTTON_L2 = 104;
    public static final int BUTTON_R2 = 105;
    public static final int BUTTON_L3 = 106;
    public static final int BUTTON_R3 = 107;
    public static final int BUTTON_OPTIONS = 108;
    public static final int BUTTON_SHARE = 109;
    public static final int BUTTON_PS = 110;

    public static final int AXIS_LEFT_X = 0;
    public static final int AXIS_LEFT_Y = 1;
    public static final int AXIS_RIGHT_X = 11;
    public static final int AXIS_RIGHT_Y = 14;
    public static final int AXIS_L2_TRIGGER = 17;
    public static final int AXIS_R2_TRIGGER = 18;

    /** Touchpad codes select the coordinate a sample carries. */
    public static final int TOUCHPAD_X = 0;
    public static final int TOUCHPAD_Y = 1;

    private ControllerCodes() {}

    /**
     * Human-readable button name for logs, e.g. {@code "Cross"}.
     */
    public static String buttonName(int code)
    {
        return switch (code) {
            case BUTTON_CROSS -> "Cross";
            case BUTTON_CIRCLE -> "Circle";
            case BUTTON_SQUARE -> "Square";
            case BUTTON_TRIANGLE -> "Triangle";
            case BUTTON_L1 -> "L1";
            case BUTTON_R1 -> "R1";
            case BUTTON_L2 -> "L2";
            case BUTTON_R2 -> "R2";
            case BUTTON_L3 -> "L3";
            case BUTTON_R3 -> "R3";
            case BUTTON_OPTIONS -> "Options";
            case BUTTON_SHARE -> "Share";
            case BUTTON_PS -> "PS";
            default -> "Unknown(" + code + ")";
        };
    }
}
