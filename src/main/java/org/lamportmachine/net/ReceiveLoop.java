package org.lamportmachine.net;

import org.lamportmachine.interfaces.InboundQueue;
import org.lamportmachine.wire.MalformedMessageException;
import org.lamportmachine.wire.MessageCodec;
import org.lamportmachine.wire.RecordReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Socket;

/**
 * Blocking read loop for one accepted socket.
 * <p>
 * Every well-formed record is pushed onto the shared {@link InboundQueue}; a
 * malformed record is dropped with a warning and reading continues. The loop
 * ends on EOF or on any socket error and always closes its socket.
 * </p>
 */
public final class ReceiveLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ReceiveLoop.class);

    private final Socket socket;
    private final InboundQueue queue;
    private final MessageCodec codec;
    private final Runnable onExit;
    private final String label;

    /**
     * @param socket connected socket to read from
     * @param queue  destination of decoded messages
     * @param codec  wire format
     * @param onExit invoked once after the socket is closed; may be {@code null}
     */
    public ReceiveLoop(Socket socket, InboundQueue queue, MessageCodec codec, Runnable onExit) {
        this.socket = socket;
        this.queue = queue;
        this.codec = codec;
        this.onExit = onExit;
        this.label = String.valueOf(socket.getRemoteSocketAddress());
    }

    @Override
    public void run() {
        try (Socket s = socket) {
            RecordReader records = codec.reader(s.getInputStream());
            while (true) {
                String line;
                try {
                    line = records.next();
                } catch (MalformedMessageException e) {
                    log.warn("Dropping malformed record from {}: '{}' ({})", label, e.fragment(), e.getMessage());
                    continue;
                }
                if (line == null) break;
                if (line.isBlank()) continue;
                try {
                    queue.push(codec.decode(line));
                } catch (MalformedMessageException e) {
                    log.warn("Dropping malformed record from {}: '{}' ({})", label, e.fragment(), e.getMessage());
                }
            }
            log.debug("Peer {} closed the connection", label);
        } catch (IOException e) {
            // Closing the socket during shutdown lands here as well
            log.debug("Receive loop for {} ended: {}", label, e.getMessage());
        } finally {
            if (onExit != null) onExit.run();
        }
    }
}
