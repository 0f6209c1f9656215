package org.lamportmachine.log;

import java.util.Locale;

/**
 * Text form of an {@link EventRecord}:
 * <pre>
 * &lt;wallClockTime&gt;, &lt;eventType&gt;, L=&lt;logicalClock&gt;[, queue=&lt;n&gt;][, note=&lt;text&gt;]
 * </pre>
 * Wall-clock time is printed with four decimals. The note is always last, so it may contain commas.
 */
public final class EventRecordFormat {

    private static final String SEP = ", ";
    private static final String CLOCK = "L=";
    private static final String QUEUE = "queue=";
    private static final String NOTE = "note=";

    private EventRecordFormat() {}

    public static String format(EventRecord r) {
        StringBuilder sb = new StringBuilder(64);
        sb.append(String.format(Locale.ROOT, "%.4f", r.wallClockTime()))
                .append(SEP).append(r.type().label())
                .append(SEP).append(CLOCK).append(r.logicalClock());
        if (r.queueLength() != null) {
            sb.append(SEP).append(QUEUE).append(r.queueLength());
        }
        if (r.note() != null) {
            sb.append(SEP).append(NOTE).append(r.note());
        }
        return sb.toString();
    }

    /**
     * Parses one log line.
     *
     * @throws IllegalArgumentException if the line does not follow the format
     */
    public static EventRecord parse(String line) {
        String body = line;
        String note = null;
        int n = line.indexOf(SEP + NOTE);
        if (n >= 0) {
            note = line.substring(n + SEP.length() + NOTE.length());
            body = line.substring(0, n);
        }

        String[] parts = body.split(SEP, -1);
        if (parts.length < 3 || parts.length > 4) {
            throw new IllegalArgumentException("malformed log line: " + line);
        }
        try {
            double time = Double.parseDouble(parts[0]);
            EventType type = EventType.fromLabel(parts[1]);
            long clock = Long.parseLong(field(parts[2], CLOCK, line));
            Integer queue = parts.length == 4 ? Integer.valueOf(field(parts[3], QUEUE, line)) : null;
            return new EventRecord(time, type, clock, queue, note);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("malformed number in log line: " + line, e);
        }
    }

    private static String field(String part, String prefix, String line) {
        if (!part.startsWith(prefix)) {
            throw new IllegalArgumentException("expected '" + prefix + "' in log line: " + line);
        }
        return part.substring(prefix.length());
    }
}
