package org.lamportmachine.machine;

import org.lamportmachine.log.EventType;

/**
 * Local actions a machine may take on a tick with an empty inbound queue.
 */
public enum Action {
    /** Send to one peer chosen at random. */
    SEND_ONE(EventType.SEND_ONE),
    /** Send to the second active peer, or the only one if there is just one. */
    SEND_OTHER(EventType.SEND_OTHER),
    /** Send to every active peer. */
    BROADCAST(EventType.BROADCAST),
    /** Advance the clock without any network activity. */
    INTERNAL(EventType.INTERNAL);

    private final EventType eventType;

    Action(EventType eventType) {
        this.eventType = eventType;
    }

    public EventType eventType() {
        return eventType;
    }
}
