package org.lamportmachine.util;

import org.lamportmachine.interfaces.LamportClock;

/**
 * Lamport logical clock owned by a single writer thread.
 * <p>
 * <b>Concurrency notes:</b>
 * <ul>
 *   <li>The first thread that mutates the clock becomes its owner; a mutation from
 *       any other thread fails with {@link IllegalStateException}.</li>
 *   <li>Receive loops never touch the clock. They only enqueue, so the event loop
 *       is the sole writer and no lock or CAS is needed.</li>
 *   <li>The value is {@code volatile} so that other threads may read it for
 *       reporting.</li>
 * </ul>
 */
public final class ConfinedLamportClock implements LamportClock {

    // Current Lamport timestamp, starts at zero
    private volatile long time;

    // Thread allowed to mutate; bound lazily on first mutation
    private volatile Thread owner;

    /**
     * Returns the current Lamport timestamp.
     *
     * @return current clock value
     */
    @Override
    public long get() {
        return time;
    }

    /**
     * Increments the clock for a local event (message send or internal action).
     *
     * @return the incremented timestamp value
     */
    @Override
    public long tickLocal() {
        checkOwner();
        time = time + 1;
        return time;
    }

    /**
     * Merges this clock with a remote Lamport timestamp and advances by one tick.
     * <p>
     * {@code newTime = max(local, remote) + 1}, reading the value current at the
     * moment of the call.
     * </p>
     *
     * @param remoteTimestamp timestamp received from another machine
     * @return the updated clock value
     */
    @Override
    public long tickReceive(long remoteTimestamp) {
        checkOwner();
        time = Math.max(time, remoteTimestamp) + 1;
        return time;
    }

    private void checkOwner() {
        Thread current = Thread.currentThread();
        if (owner == null) {
            owner = current;
        } else if (owner != current) {
            throw new IllegalStateException("Lamport clock owned by " + owner.getName()
                    + " mutated from " + current.getName());
        }
    }

    @Override
    public String toString() {
        return "LamportClock{" + "time=" + time + '}';
    }
}
