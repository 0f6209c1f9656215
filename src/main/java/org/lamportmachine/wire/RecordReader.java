package org.lamportmachine.wire;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Splits an inbound character stream into newline-terminated records while
 * holding at most a fixed number of characters in memory.
 * <p>
 * A record longer than the limit is consumed up to its terminator and reported
 * as malformed, with only its first characters kept as the fragment. The reader
 * stays usable afterwards.
 * </p>
 */
public final class RecordReader {

    private final Reader in;
    private final int limit;
    private final StringBuilder buf;
    private boolean eof;

    /**
     * @param in    source stream; buffered internally if it is not already
     * @param limit maximum record length kept, terminator excluded
     */
    public RecordReader(Reader in, int limit) {
        this.in = in instanceof BufferedReader ? in : new BufferedReader(in);
        this.limit = limit;
        this.buf = new StringBuilder(limit);
    }

    /**
     * Returns the next record without its terminator.
     *
     * @return the record, or {@code null} at end of stream
     * @throws MalformedMessageException if the record exceeds the limit; it has been skipped
     * @throws IOException               on read failure
     */
    public String next() throws IOException, MalformedMessageException {
        if (eof) return null;
        buf.setLength(0);
        int c;
        while ((c = in.read()) != -1) {
            if (c == MessageCodec.DELIMITER) {
                return buf.toString();
            }
            if (buf.length() == limit) {
                String fragment = buf + "...";
                long skipped = limit + 1 + discardRecord();
                throw new MalformedMessageException("record exceeds " + limit + " chars (" + skipped
                        + (eof ? " chars before end of stream)" : " chars)"), fragment);
            }
            buf.append((char) c);
        }
        eof = true;
        // Unterminated tail at end of stream still counts as a record
        return buf.length() == 0 ? null : buf.toString();
    }

    // Consumes the rest of an oversized record; returns the number of characters dropped
    private long discardRecord() throws IOException {
        long n = 0;
        int c;
        while ((c = in.read()) != -1) {
            if (c == MessageCodec.DELIMITER) return n;
            n++;
        }
        eof = true;
        return n;
    }
}
