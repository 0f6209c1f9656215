package org.lamportmachine.util;

import org.lamportmachine.interfaces.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;

/**
 * SimpleRetryExecutor is the connect policy used when dialing peers: a bounded
 * number of attempts separated by an exponential backoff with optional jitter.
 * <p>
 * With {@code baseDelayMs == maxDelayMs} the delay is constant, which is the
 * default peer dialing policy (5 attempts, 1 s apart).
 * </p>
 */
public final class SimpleRetryExecutor implements RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(SimpleRetryExecutor.class);

    /** Granularity at which an abort request is noticed while waiting. */
    static final long ABORT_CHECK_MS = 50;

    private static final BooleanSupplier NEVER = () -> false;

    /** Maximum number of attempts (inclusive of first try). */
    private final int maxAttempts;

    /** Initial delay before retrying, in milliseconds. */
    private final long baseDelayMs;

    /** Maximum allowed delay between retries, in milliseconds. */
    private final long maxDelayMs;

    /** Maximum random jitter applied to each delay, in milliseconds. */
    private final long jitterMs;

    /**
     * Constructs a retry executor with configurable attempt and delay settings.
     *
     * @param maxAttempts maximum number of attempts (minimum 1)
     * @param baseDelayMs base delay in milliseconds before first retry
     * @param maxDelayMs maximum delay cap for exponential backoff
     * @param jitterMs random jitter range in milliseconds (adds up to this amount)
     */
    public SimpleRetryExecutor(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs  = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterMs    = Math.max(0, jitterMs);
    }

    /** Constant-delay policy. */
    public static SimpleRetryExecutor fixedDelay(int maxAttempts, long delayMs) {
        return new SimpleRetryExecutor(maxAttempts, delayMs, delayMs, 0);
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Executes the provided operation with retry semantics.
     * <p>
     * The n-th retry waits {@code baseDelayMs * 2^(n-1)}, capped by
     * {@code maxDelayMs}, plus a random jitter of at most {@code jitterMs}.
     * </p>
     *
     * @param op the operation to execute; should throw on transient failure
     * @param <T> return type of the callable
     * @return result of {@code op.call()} if successful
     * @throws Exception the last failure once all attempts are used up
     */
    @Override
    public <T> T execute(Callable<T> op) throws Exception {
        return execute(op, NEVER);
    }

    /**
     * Same as {@link #execute(Callable)}, but {@code abort} is checked before every
     * attempt and at least every {@value #ABORT_CHECK_MS} ms while waiting. Once it
     * reports true no further attempt is made.
     *
     * @throws CancellationException if aborted before the first attempt
     * @throws Exception             the last failure once aborted or out of attempts
     */
    @Override
    public <T> T execute(Callable<T> op, BooleanSupplier abort) throws Exception {
        if (abort.getAsBoolean()) {
            throw new CancellationException("aborted before first attempt");
        }
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return op.call();
            } catch (Exception e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }

                long delay = baseDelayMs << Math.min(30, attempt - 1);
                if (delay > maxDelayMs || delay < 0) delay = maxDelayMs;

                long sleep = delay + (jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs) : 0L);

                log.info("Attempt {}/{} failed ({}), retrying in {} ms",
                        attempt, maxAttempts, e.getMessage(), sleep);

                try {
                    if (!pause(sleep, abort)) {
                        log.info("Retry aborted after attempt {}/{}", attempt, maxAttempts);
                        throw e;
                    }
                } catch (InterruptedException ie) {
                    // Restore interrupt flag before rethrowing
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    /** Sleeps for {@code ms}; returns false as soon as {@code abort} reports true. */
    private static boolean pause(long ms, BooleanSupplier abort) throws InterruptedException {
        long deadline = System.nanoTime() + ms * 1_000_000L;
        while (true) {
            if (abort.getAsBoolean()) {
                return false;
            }
            long left = (deadline - System.nanoTime()) / 1_000_000L;
            if (left <= 0) {
                return true;
            }
            Thread.sleep(Math.min(left, ABORT_CHECK_MS));
        }
    }
}
