package org.lamportmachine.net;

import org.lamportmachine.interfaces.InboundQueue;
import org.lamportmachine.wire.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Accepts inbound peer connections and runs one {@link ReceiveLoop} thread per socket.
 * <p>
 * The accept loop runs on its own daemon thread until {@link #close()} closes the
 * server socket, which unblocks {@code accept()}. Closing also closes every accepted
 * socket so that their receive loops end.
 * </p>
 */
public final class Listener implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(Listener.class);

    /** Pending-connection backlog for the server socket. */
    public static final int BACKLOG = 5;

    private final ServerSocket server;
    private final InboundQueue queue;
    private final MessageCodec codec;
    private final String name;
    private final Set<Socket> accepted = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;
    private Thread acceptThread;

    private Listener(ServerSocket server, InboundQueue queue, MessageCodec codec, String name) {
        this.server = server;
        this.queue = queue;
        this.codec = codec;
        this.name = name;
    }

    /**
     * Binds the listening socket. Nothing is accepted until {@link #start()}.
     *
     * @param host bind address
     * @param port bind port, 0 for an ephemeral port
     * @param name label used for thread names
     * @throws IOException if the address cannot be bound
     */
    public static Listener bind(String host, int port, InboundQueue queue, MessageCodec codec, String name)
            throws IOException {
        ServerSocket ss = new ServerSocket();
        try {
            ss.setReuseAddress(true);
            ss.bind(new InetSocketAddress(host, port), BACKLOG);
        } catch (IOException e) {
            ss.close();
            throw e;
        }
        return new Listener(ss, queue, codec, name);
    }

    /** Starts the accept loop thread. */
    public synchronized void start() {
        if (acceptThread != null) {
            throw new IllegalStateException("listener already started");
        }
        acceptThread = new Thread(this::acceptLoop, "acceptor-" + name);
        acceptThread.setDaemon(true);
        acceptThread.start();
    }

    private void acceptLoop() {
        log.info("Listening on {}", server.getLocalSocketAddress());
        while (!closed) {
            Socket s;
            try {
                s = server.accept();
            } catch (IOException e) {
                if (closed || server.isClosed()) {
                    break;
                }
                log.warn("Accept failed on {}: {}", server.getLocalSocketAddress(), e.getMessage());
                continue;
            }
            final Socket conn = s;
            accepted.add(conn);
            if (closed) {
                closeQuietly(conn);
                break;
            }
            Thread t = new Thread(new ReceiveLoop(conn, queue, codec, () -> accepted.remove(conn)),
                    "receive-" + name + "-" + conn.getPort());
            t.setDaemon(true);
            t.start();
        }
        log.debug("Accept loop on {} stopped", name);
    }

    /** Actual bound port; useful when bound to port 0. */
    public int localPort() {
        return server.getLocalPort();
    }

    /** Number of inbound connections whose receive loop is still running. */
    public int openConnections() {
        return accepted.size();
    }

    /** Idempotent. */
    @Override
    public void close() {
        Thread t;
        synchronized (this) {
            if (closed) return;
            closed = true;
            t = acceptThread;
        }
        closeQuietly(server);
        for (Socket s : accepted) {
            closeQuietly(s);
        }
        if (t != null) {
            try {
                t.join(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void closeQuietly(Closeable c) {
        try {
            c.close();
        } catch (IOException e) {
            log.debug("Close failed: {}", e.getMessage());
        }
    }
}
