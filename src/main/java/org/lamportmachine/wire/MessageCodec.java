package org.lamportmachine.wire;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * MessageCodec implements the peer-to-peer wire format.
 * <p>
 * Each message is one ASCII line {@code "<timestamp>:<senderId>\n"}. A send is a
 * single write of the whole line; a receive is one newline-delimited record.
 * </p>
 */
public final class MessageCodec {

    /** Record terminator. */
    public static final char DELIMITER = '\n';

    /** Longest record accepted on input, terminator excluded. */
    public static final int MAX_RECORD_LENGTH = 64;

    /**
     * Serializes a message as a complete, terminated record.
     *
     * @param message message to encode
     * @return ASCII bytes ready for a single write
     */
    public byte[] encode(WireMessage message) {
        String line = message.timestamp() + ":" + message.senderId() + DELIMITER;
        return line.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Writes one encoded record and flushes it.
     *
     * @throws IOException if the stream rejects the write
     */
    public void write(OutputStream out, WireMessage message) throws IOException {
        out.write(encode(message));
        out.flush();
    }

    /**
     * Parses one record, without its terminator. A trailing carriage return is tolerated.
     *
     * @param record the received line
     * @return the decoded message
     * @throws MalformedMessageException if the record is not two decimal integers separated by ':'
     */
    public WireMessage decode(String record) throws MalformedMessageException {
        if (record == null) {
            throw new MalformedMessageException("null record", null);
        }
        String s = record.endsWith("\r") ? record.substring(0, record.length() - 1) : record;
        s = s.trim();
        if (s.length() > MAX_RECORD_LENGTH) {
            throw new MalformedMessageException("record too long (" + s.length() + " chars)", record);
        }
        int colon = s.indexOf(':');
        if (colon <= 0 || colon == s.length() - 1 || s.indexOf(':', colon + 1) >= 0) {
            throw new MalformedMessageException("expected <timestamp>:<senderId>", record);
        }
        try {
            long timestamp = Long.parseLong(s.substring(0, colon));
            int senderId = Integer.parseInt(s.substring(colon + 1));
            if (timestamp < 0) {
                throw new MalformedMessageException("negative timestamp", record);
            }
            return new WireMessage(timestamp, senderId);
        } catch (NumberFormatException e) {
            throw new MalformedMessageException("non-numeric field", record, e);
        }
    }

    /**
     * Opens a bounded record reader over a socket input stream. A trailing
     * carriage return is allowed beyond {@link #MAX_RECORD_LENGTH}.
     */
    public RecordReader reader(InputStream in) {
        return new RecordReader(new InputStreamReader(in, StandardCharsets.US_ASCII), MAX_RECORD_LENGTH + 1);
    }
}
