package app;

import org.lamportmachine.log.EventLogAnalyzer;
import org.lamportmachine.log.EventType;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Prints a summary for each machine log given on the command line.
 * <pre>
 * java app.LogReport machine_1.log machine_2.log machine_3.log
 * </pre>
 */
public final class LogReport {

    private LogReport() {}

    public static void main(String[] args) {
        if (args.length == 0) {
            System.out.println("Usage:\n  LogReport <machine_N.log> [...]");
            return;
        }
        int failures = report(args, System.out);
        if (failures > 0) {
            System.exit(1);
        }
    }

    /** Writes one block per file; returns the number of files that could not be read. */
    static int report(String[] files, PrintStream out) {
        int failures = 0;
        for (String f : files) {
            try {
                EventLogAnalyzer.Summary s = EventLogAnalyzer.analyze(Path.of(f));
                out.println(f);
                out.printf(Locale.ROOT, "  records=%d duration=%.1fs finalL=%d maxJump=%d maxQueue=%d monotonic=%s%n",
                        s.records(), s.durationSeconds(), s.finalClock(), s.maxClockJump(),
                        s.maxQueueLength(), s.strictlyIncreasing());
                StringBuilder counts = new StringBuilder("  ");
                for (EventType t : EventType.values()) {
                    counts.append(t.label()).append('=').append(s.count(t)).append(' ');
                }
                out.println(counts.toString().stripTrailing());
            } catch (IOException e) {
                out.println(f + ": " + e.getMessage());
                failures++;
            }
        }
        return failures;
    }
}
