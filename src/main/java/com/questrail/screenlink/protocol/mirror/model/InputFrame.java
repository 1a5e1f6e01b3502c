package com.questrail.screenlink.protocol.mirror.model;

import com.questrail.screenlink.api.InputEvent;

import java.util.Objects;

/**
 * An input frame. Input travels unencrypted; the frame is a thin wrapper
 * around the decoded controller sample.
 */
public record InputFrame(InputEvent event) implements MirrorFrame
{
    public InputFrame
    {
        Objects.requireNonNull(event, "event");
    }

    @Override
    public FrameType type()
    {
        return FrameType.INPUT;
    }
}
