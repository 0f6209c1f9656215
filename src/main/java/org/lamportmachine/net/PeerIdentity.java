package org.lamportmachine.net;

import java.util.Objects;

/**
 * Address of one peer machine plus its position in the configured peer list.
 *
 * @param host    peer host name or address
 * @param port    peer listening port
 * @param ordinal zero-based index in the peer list
 */
public record PeerIdentity(String host, int port, int ordinal) {

    public PeerIdentity {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("blank peer host");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("peer port out of range: " + port);
        }
        if (ordinal < 0) {
            throw new IllegalArgumentException("negative peer ordinal: " + ordinal);
        }
    }

    /** {@code host:port}, as written in configuration. */
    public String address() {
        return host + ":" + port;
    }

    /** True when this peer points at the given host and port. */
    public boolean sameAddress(String otherHost, int otherPort) {
        return port == otherPort && host.equalsIgnoreCase(otherHost);
    }

    @Override
    public String toString() {
        return "peer#" + ordinal + "(" + address() + ")";
    }
}
