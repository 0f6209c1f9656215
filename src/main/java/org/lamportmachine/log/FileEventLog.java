package org.lamportmachine.log;

import org.lamportmachine.interfaces.EventSink;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only event log file, one formatted {@link EventRecord} per line.
 * <p>
 * The file is {@code machine_<id>.log} in the given directory and is truncated
 * when opened. Every line is flushed as soon as it is written so that the log
 * survives an abrupt process exit.
 * </p>
 */
public final class FileEventLog implements EventSink {

    private final Path file;
    private final BufferedWriter writer;
    private boolean closed;

    public FileEventLog(Path file) throws IOException {
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    /** Opens {@code machine_<machineId>.log} under {@code dir}. */
    public static FileEventLog forMachine(Path dir, int machineId) throws IOException {
        return new FileEventLog(dir.resolve(fileName(machineId)));
    }

    public static String fileName(int machineId) {
        return "machine_" + machineId + ".log";
    }

    @Override
    public synchronized void append(EventRecord record) throws IOException {
        if (closed) {
            throw new IOException("event log " + file + " is closed");
        }
        writer.write(EventRecordFormat.format(record));
        writer.newLine();
        writer.flush();
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) return;
        closed = true;
        writer.close();
    }
}
