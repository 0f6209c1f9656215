package org.lamportmachine.interfaces;

import org.lamportmachine.log.EventRecord;

import java.io.Closeable;
import java.io.IOException;

/**
 * Append-only destination for a machine's event records.
 */
public interface EventSink extends Closeable {

    void append(EventRecord record) throws IOException;

    @Override
    void close() throws IOException;
}
