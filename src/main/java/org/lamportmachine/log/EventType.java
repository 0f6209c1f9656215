package org.lamportmachine.log;

/**
 * Kinds of event a machine records. {@link #label()} is the text written to the log.
 */
public enum EventType {
    INIT("INIT"),
    RECEIVE("RECEIVE"),
    SEND_ONE("SEND(1)"),
    SEND_OTHER("SEND(2)"),
    BROADCAST("SEND(3)"),
    INTERNAL("INTERNAL"),
    SHUTDOWN("SHUTDOWN");

    private final String label;

    EventType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** True for events caused locally, which advance the clock by exactly one. */
    public boolean isLocal() {
        return this == SEND_ONE || this == SEND_OTHER || this == BROADCAST || this == INTERNAL;
    }

    public static EventType fromLabel(String label) {
        for (EventType t : values()) {
            if (t.label.equals(label)) return t;
        }
        throw new IllegalArgumentException("unknown event type: " + label);
    }
}
