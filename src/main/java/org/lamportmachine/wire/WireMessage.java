package org.lamportmachine.wire;

/**
 * One timestamped message exchanged between machines.
 *
 * @param timestamp sender's Lamport clock after its send event
 * @param senderId  id of the sending machine
 */
public record WireMessage(long timestamp, int senderId) {
}
