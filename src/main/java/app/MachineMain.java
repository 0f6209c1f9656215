package app;

import org.lamportmachine.config.ConfigLoader;
import org.lamportmachine.config.MachineConfig;
import org.lamportmachine.machine.Machine;
import org.lamportmachine.machine.MachineStartupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point running a single machine.
 * <pre>
 * java app.MachineMain --id=1 --port=5001 --peers=localhost:5002,localhost:5003 --run_time=60
 * </pre>
 * Exit codes: 0 after a clean shutdown, 1 for invalid arguments, 2 when the port cannot be bound.
 */
public final class MachineMain {

    private static final Logger log = LoggerFactory.getLogger(MachineMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_BIND = 2;

    /** How long the shutdown hook waits for the event loop to write SHUTDOWN and close. */
    static final long STOP_WAIT_MS = 5_000;

    private MachineMain() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        MachineConfig config;
        try {
            config = ConfigLoader.fromArgs(args);
        } catch (IllegalArgumentException | IOException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            return EXIT_USAGE;
        }

        Machine machine;
        try {
            machine = Machine.create(config);
        } catch (IOException e) {
            log.error("Cannot open event log in {}: {}", config.logDir(), e.getMessage());
            return EXIT_USAGE;
        }

        // The main thread stays blocked in System.exit during shutdown, so the hook
        // waits on this latch rather than on the thread itself
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = stopHook(machine, finished, "machine-" + config.id() + "-stop");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            machine.run();
        } catch (MachineStartupException e) {
            log.error(e.getMessage());
            return EXIT_BIND;
        } finally {
            finished.countDown();
            removeHook(hook);
        }
        System.out.println("Machine " + config.id() + " finished.");
        return EXIT_OK;
    }

    /** Hook that asks the machine to stop and waits for its run to finish. */
    static Thread stopHook(Machine machine, CountDownLatch finished, String name) {
        return new Thread(() -> {
            machine.requestStop();
            try {
                if (!finished.await(STOP_WAIT_MS, TimeUnit.MILLISECONDS)) {
                    log.warn("Machine {} did not finish within {} ms of the stop request", machine.id(), STOP_WAIT_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, name);
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook is running
            log.debug("Shutdown in progress: {}", e.getMessage());
        }
    }

    private static void printUsage() {
        System.err.println("Usage:\n  MachineMain --id=<n> --port=<port> --peers=<host:port,...>"
                + " [--host=<addr>] [--run_time=<s>] [--ticks=<n> | --max_ticks=<n>]"
                + " [--internal_prob=<p>] [--connect_attempts=<n>] [--connect_delay_ms=<ms>]"
                + " [--connect_max_delay_ms=<ms>] [--connect_jitter_ms=<ms>]"
                + " [--log_dir=<dir>] [--seed=<n>] [--config=<file.json>]");
    }
}
