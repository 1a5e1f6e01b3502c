package com.questrail.screenlink.api;

import java.util.Optional;

/**
 * InputKind
 * -----------------------------------------------------------------------------
 * Class of a controller sample. Each kind has a stable ASCII name that is
 * written on the wire ahead of the code/value pair.
 */
public enum InputKind
{
    BUTTON("button"),
    AXIS("axis"),
    TOUCHPAD("touchpad");

    private final String wireName;

    InputKind(String wireName)
    {
        this.wireName = wireName;
    }

    public String wireName()
    {
        return wireName;
    }

    /**
     * Resolves a wire name back to its kind.
     *
     * @return the kind, or empty if the name is not one this core understands
     */
    public static Optional<InputKind> fromWireName(String name)
    {
        for (InputKind kind : values()) {
            if (kind.wireName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
