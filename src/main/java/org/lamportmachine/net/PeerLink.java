package org.lamportmachine.net;

import org.lamportmachine.interfaces.RetryExecutor;
import org.lamportmachine.wire.MessageCodec;
import org.lamportmachine.wire.WireMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.function.BooleanSupplier;

/**
 * Outbound, send-only connection to one peer.
 * <p>
 * A link is created by {@link #connect}, which dials under a {@link RetryExecutor}
 * policy. Once a write fails the link closes itself and stays closed; it is never
 * re-dialed.
 * </p>
 */
public final class PeerLink implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(PeerLink.class);

    /** Connect timeout for a single attempt. */
    public static final int CONNECT_TIMEOUT_MS = 2_000;

    private final PeerIdentity peer;
    private final Socket socket;
    private final OutputStream out;
    private final MessageCodec codec;
    private volatile boolean closed;

    PeerLink(PeerIdentity peer, Socket socket, MessageCodec codec) throws IOException {
        this.peer = peer;
        this.socket = socket;
        this.out = socket.getOutputStream();
        this.codec = codec;
    }

    /**
     * Dials a peer, retrying according to {@code retry}.
     *
     * @param peer  the peer to reach
     * @param retry attempt count and backoff between attempts
     * @param codec wire format used for later sends
     * @return an open link
     * @throws IOException if every attempt failed
     */
    public static PeerLink connect(PeerIdentity peer, RetryExecutor retry, MessageCodec codec) throws IOException {
        return connect(peer, retry, codec, () -> false);
    }

    /**
     * Dials a peer like {@link #connect(PeerIdentity, RetryExecutor, MessageCodec)},
     * giving up between attempts once {@code abort} reports true.
     *
     * @throws IOException if every attempt failed or dialing was aborted
     */
    public static PeerLink connect(PeerIdentity peer, RetryExecutor retry, MessageCodec codec,
                                   BooleanSupplier abort) throws IOException {
        Socket socket;
        try {
            socket = retry.execute(() -> open(peer), abort);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("connect to " + peer.address() + " failed", e);
        }
        try {
            PeerLink link = new PeerLink(peer, socket, codec);
            log.info("Connected to {}", peer);
            return link;
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    private static Socket open(PeerIdentity peer) throws IOException {
        Socket s = new Socket();
        try {
            s.connect(new InetSocketAddress(peer.host(), peer.port()), CONNECT_TIMEOUT_MS);
            s.setTcpNoDelay(true);
            return s;
        } catch (IOException e) {
            s.close();
            throw e;
        }
    }

    /**
     * Sends {@code "<timestamp>:<senderId>"} as one atomic record.
     * On failure the link is closed before the exception propagates.
     *
     * @throws IOException if the link is closed or the write fails
     */
    public synchronized void send(long timestamp, int senderId) throws IOException {
        if (closed) {
            throw new IOException("link to " + peer.address() + " is closed");
        }
        try {
            codec.write(out, new WireMessage(timestamp, senderId));
        } catch (IOException e) {
            close();
            throw e;
        }
    }

    public PeerIdentity peer() {
        return peer;
    }

    public boolean isOpen() {
        return !closed;
    }

    /** Idempotent. */
    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing link to {}: {}", peer, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "PeerLink{" + peer + (closed ? ", closed" : "") + '}';
    }
}
