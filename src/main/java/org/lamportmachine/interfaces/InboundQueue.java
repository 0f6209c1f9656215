package org.lamportmachine.interfaces;

import org.lamportmachine.wire.WireMessage;

/**
 * FIFO of received messages shared between the receive loops (producers)
 * and the event loop (sole consumer).
 */
public interface InboundQueue {

    /** Appends a message; safe to call from any receive loop thread. */
    void push(WireMessage message);

    /**
     * Removes the oldest message.
     * @return the head of the queue, or {@code null} when empty
     */
    WireMessage poll();

    /** Number of messages waiting. */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
