package org.lamportmachine.log;

import java.util.Objects;

/**
 * One immutable line of a machine's event log.
 *
 * @param wallClockTime seconds since the epoch
 * @param type          event kind
 * @param logicalClock  clock value after the event's update
 * @param queueLength   inbound queue length after the pop; only for RECEIVE, otherwise {@code null}
 * @param note          free text, or {@code null}
 */
public record EventRecord(double wallClockTime, EventType type, long logicalClock,
                          Integer queueLength, String note) {

    public EventRecord {
        Objects.requireNonNull(type, "type");
        if (queueLength != null && type != EventType.RECEIVE) {
            throw new IllegalArgumentException("queue length is only recorded for RECEIVE");
        }
        if (note != null && (note.isEmpty() || note.indexOf('\n') >= 0)) {
            throw new IllegalArgumentException("note must be a non-empty single line");
        }
    }

    public static EventRecord of(EventType type, long logicalClock, String note) {
        return new EventRecord(nowSeconds(), type, logicalClock, null, note);
    }

    public static EventRecord receive(long logicalClock, int queueLength) {
        return new EventRecord(nowSeconds(), EventType.RECEIVE, logicalClock, queueLength, null);
    }

    static double nowSeconds() {
        return System.currentTimeMillis() / 1000.0;
    }
}
