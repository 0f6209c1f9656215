package org.lamportmachine.interfaces;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

public interface RetryExecutor {
    /**
     * Executes the given operation with retry.
     * @param op  A Callable whose call() may throw Exception. Returns a result or null.
     * @param <T> Result type (use Void for no result)
     * @return the result from the operation
     * @throws Exception if all attempts fail
     */
    <T> T execute(Callable<T> op) throws Exception;

    /**
     * Like {@link #execute(Callable)}, but gives up as soon as {@code abort} reports true.
     * This default only checks before starting; implementations that wait between
     * attempts should also check while waiting.
     *
     * @throws CancellationException if aborted before any attempt was made
     * @throws Exception             the last failure if aborted later or out of attempts
     */
    default <T> T execute(Callable<T> op, BooleanSupplier abort) throws Exception {
        if (abort.getAsBoolean()) {
            throw new CancellationException("aborted before first attempt");
        }
        return execute(op);
    }

    /** Maximum number of attempts, first try included. */
    int maxAttempts();
}
