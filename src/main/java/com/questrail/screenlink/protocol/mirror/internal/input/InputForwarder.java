package com.questrail.screenlink.protocol.mirror.internal.input;

import com.questrail.screenlink.api.InputEvent;
import com.questrail.screenlink.api.MirrorSession;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for the input-capture collaborator: filters each sample and
 * queues the survivors on the session.
 */
public final class InputForwarder
{
    private final InputStateFilter filter;
    private final MirrorSession session;

    public InputForwarder(InputStateFilter filter, MirrorSession session)
    {
        this.filter = Objects.requireNonNull(filter, "filter");
        this.session = Objects.requireNonNull(session, "session");
    }

    /**
     * @return {@code true} if a frame was queued for the peer
     */
    public boolean submit(InputEvent event)
    {
        Optional<InputEvent> filtered = filter.filter(event);
        if (filtered.isEmpty()) {
            return false;
        }

        if (session.sendInputEvent(filtered.get())) {
            return true;
        }

        // Not delivered; let the next sample for this control through.
        filter.invalidate(event.kind(), event.code());
        return false;
    }

    /** Forgets all remembered control state, e.g. when capture stops. */
    public void clear()
    {
        filter.clear();
    }
}
