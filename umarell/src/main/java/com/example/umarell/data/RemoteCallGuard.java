package com.example.umarell.data;

import com.example.umarell.errors.InspectorException;
import com.example.umarell.errors.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a remote call with a deadline. If the deadline passes, or the calling thread is
 * interrupted, the call is cancelled and the caller gets an error instead of a result.
 * Calls are never retried.
 */
public class RemoteCallGuard {

    private static final Logger log = LoggerFactory.getLogger(RemoteCallGuard.class);

    private final ExecutorService executor;
    private final Duration defaultTimeout;

    public RemoteCallGuard(int threads, Duration defaultTimeout) {
        AtomicInteger n = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "umarell-remote-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.defaultTimeout = defaultTimeout;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public <T> T call(Stage stage, Duration timeout, Callable<T> remote) {
        Duration limit = (timeout == null || timeout.isZero() || timeout.isNegative()) ? defaultTimeout : timeout;
        Future<T> future = executor.submit(remote);
        try {
            return future.get(limit.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} call timed out after {} ms", stage.code(), limit.toMillis());
            throw InspectorException.timedOut(stage,
                    stage.code() + " store did not answer within " + limit.toMillis() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw InspectorException.queryFailed(stage, stage.code() + " call cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InspectorException ie) {
                throw ie;
            }
            log.error("{} call failed", stage.code(), cause);
            throw InspectorException.queryFailed(stage,
                    stage.code() + " call failed: " + (cause == null ? e.getMessage() : cause.getMessage()), cause);
        }
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
