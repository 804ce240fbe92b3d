package com.smurthy.ai.tutor.support;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a blocking I/O step on the shared step executor with an explicit
 * deadline. The step is cancelled (interrupted) when the deadline passes or
 * when the waiting caller is itself interrupted.
 */
public class TimeBoundedCall {

    private final ExecutorService executor;

    public TimeBoundedCall(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * @throws TimeoutException      the step did not finish within {@code timeout}
     * @throws ExecutionException    the step threw; the original exception is the cause
     * @throws CancellationException the calling thread was interrupted while waiting
     */
    public <T> T call(Callable<T> step, Duration timeout) throws TimeoutException, ExecutionException {
        Future<T> future = executor.submit(step);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Request cancelled while waiting on a downstream step");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    /**
     * Fire-and-forget submission. The task outlives the caller's request.
     */
    public void detach(Runnable task) {
        executor.execute(task);
    }
}
