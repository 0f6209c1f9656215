package org.lamportmachine.interfaces;

/**
 * A simple contract for Lamport logical clocks.
 * Provides the two update rules every machine applies: one for locally
 * generated events and one for consumed inbound messages.
 */
public interface LamportClock {

    /**
     * Returns the current logical clock value.
     */
    long get();

    /**
     * Increments the clock for a local event (send or internal step).
     * @return the updated clock value
     */
    long tickLocal();

    /**
     * Merges the clock with a timestamp carried by a received message.
     * @param remoteTimestamp the Lamport timestamp from the sender
     * @return the updated clock value, {@code max(local, remote) + 1}
     */
    long tickReceive(long remoteTimestamp);
}
