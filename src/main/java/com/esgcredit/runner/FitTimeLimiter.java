package com.esgcredit.runner;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one model fit on a thread of its own and waits for it at most the configured time.
 * The forest library builds trees on the common fork-join pool and ignores interruption, so a fit that
 * overruns keeps computing after the caller gave up. Each call gets a fresh daemon thread: an overrunning
 * fit never delays the next company's fit and never keeps the JVM alive.
 */
final class FitTimeLimiter {
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final long timeoutMillis;

    FitTimeLimiter(long timeoutMillis) {
        this.timeoutMillis = Math.max(1L, timeoutMillis);
    }

    long timeoutMillis() {
        return timeoutMillis;
    }

    <T> T call(String owner, Callable<T> task) throws InterruptedException, TimeoutException, ExecutionException {
        ExecutorService single = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "esg-fit-" + THREAD_SEQ.incrementAndGet() + "-" + owner);
            t.setDaemon(true);
            return t;
        });
        try {
            Future<T> future = single.submit(task);
            try {
                return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException | InterruptedException e) {
                future.cancel(true);
                throw e;
            }
        } finally {
            single.shutdownNow();
        }
    }
}
