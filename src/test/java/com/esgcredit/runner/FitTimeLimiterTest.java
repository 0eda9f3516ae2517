package com.esgcredit.runner;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FitTimeLimiterTest {

    @Test
    void call_shouldReturnResultOnDaemonThreadNamedAfterOwner() throws Exception {
        FitTimeLimiter limiter = new FitTimeLimiter(5_000L);

        String thread = limiter.call("acme", () -> {
            assertTrue(Thread.currentThread().isDaemon());
            return Thread.currentThread().getName();
        });

        assertTrue(thread.startsWith("esg-fit-"));
        assertTrue(thread.endsWith("-acme"));
    }

    @Test
    void call_shouldNotLetOverrunningFitDelayTheNextOne() throws Exception {
        FitTimeLimiter limiter = new FitTimeLimiter(100L);
        AtomicBoolean stillRunning = new AtomicBoolean();

        // Spins without checking interruption, like tree building on the fork-join pool.
        assertThrows(TimeoutException.class, () -> limiter.call("slow", () -> {
            stillRunning.set(true);
            long end = System.nanoTime() + 1_500_000_000L;
            while (System.nanoTime() < end) {
                Thread.onSpinWait();
            }
            stillRunning.set(false);
            return 0;
        }));
        assertTrue(stillRunning.get());

        long started = System.nanoTime();
        assertEquals(42, limiter.call("quick", () -> 42));
        assertTrue((System.nanoTime() - started) / 1_000_000L < 1_000L);
    }

    @Test
    void call_shouldWrapTaskFailure() {
        FitTimeLimiter limiter = new FitTimeLimiter(1_000L);

        ExecutionException error = assertThrows(ExecutionException.class, () -> limiter.call("broken", () -> {
            throw new IllegalStateException("no variance");
        }));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void constructor_shouldKeepAtLeastOneMillisecond() {
        assertEquals(1L, new FitTimeLimiter(0L).timeoutMillis());
    }
}
