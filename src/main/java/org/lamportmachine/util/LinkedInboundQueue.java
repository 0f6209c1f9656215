package org.lamportmachine.util;

import org.lamportmachine.interfaces.InboundQueue;
import org.lamportmachine.wire.WireMessage;

import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded multi-producer, single-consumer FIFO backed by {@link LinkedBlockingQueue}.
 * Order is arrival order, not timestamp order.
 */
public final class LinkedInboundQueue implements InboundQueue {

    private final LinkedBlockingQueue<WireMessage> messages = new LinkedBlockingQueue<>();

    @Override
    public void push(WireMessage message) {
        messages.add(Objects.requireNonNull(message, "message"));
    }

    @Override
    public WireMessage poll() {
        return messages.poll();
    }

    @Override
    public int size() {
        return messages.size();
    }

    @Override
    public String toString() {
        return "InboundQueue{" + "size=" + messages.size() + '}';
    }
}
