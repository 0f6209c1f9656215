package org.lamportmachine.log;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads machine event logs back and summarizes them: event counts, clock jumps,
 * queue backlog, and whether the logical clock only ever moved forward.
 */
public final class EventLogAnalyzer {

    /**
     * Summary of one log.
     *
     * @param records            number of records
     * @param counts             records per event type
     * @param finalClock         logical clock of the last record
     * @param maxClockJump       largest increase between consecutive records
     * @param maxQueueLength     largest queue length seen on RECEIVE
     * @param strictlyIncreasing true if every record's clock exceeds the previous one
     * @param durationSeconds    wall-clock span between first and last record
     */
    public record Summary(int records, Map<EventType, Integer> counts, long finalClock,
                          long maxClockJump, int maxQueueLength, boolean strictlyIncreasing,
                          double durationSeconds) {

        public int count(EventType type) {
            return counts.getOrDefault(type, 0);
        }
    }

    private EventLogAnalyzer() {}

    /**
     * Parses a log file; blank lines are skipped.
     *
     * @throws IOException if the file cannot be read or a line is malformed
     */
    public static List<EventRecord> read(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<EventRecord> out = new ArrayList<>(lines.size());
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line.isBlank()) continue;
            try {
                out.add(EventRecordFormat.parse(line));
            } catch (IllegalArgumentException e) {
                throw new IOException(file + ":" + lineNo + ": " + e.getMessage(), e);
            }
        }
        return out;
    }

    public static Summary analyze(List<EventRecord> records) {
        Map<EventType, Integer> counts = new EnumMap<>(EventType.class);
        long maxJump = 0;
        int maxQueue = 0;
        boolean increasing = true;
        Long previous = null;

        for (EventRecord r : records) {
            counts.merge(r.type(), 1, Integer::sum);
            if (r.queueLength() != null) {
                maxQueue = Math.max(maxQueue, r.queueLength());
            }
            if (previous != null) {
                long jump = r.logicalClock() - previous;
                if (jump <= 0 && r.type() != EventType.SHUTDOWN) {
                    increasing = false;
                }
                maxJump = Math.max(maxJump, jump);
            }
            previous = r.logicalClock();
        }

        long finalClock = records.isEmpty() ? 0 : records.get(records.size() - 1).logicalClock();
        double duration = records.size() < 2 ? 0.0
                : records.get(records.size() - 1).wallClockTime() - records.get(0).wallClockTime();
        return new Summary(records.size(), Collections.unmodifiableMap(counts), finalClock,
                maxJump, maxQueue, increasing, duration);
    }

    public static Summary analyze(Path file) throws IOException {
        return analyze(read(file));
    }
}
