package com.tyron.apphost.core.application;

import com.tyron.apphost.core.cache.CacheHelper;
import com.tyron.apphost.core.config.ApplicationSettings;
import com.tyron.apphost.core.test.RecordingGlobalStateReset;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ApplicationContextReadinessTest {

    private static ApplicationContext newContext() {
        return new ApplicationContext(new CacheHelper(), ApplicationContextOptions.builder()
                .globalStateReset(new RecordingGlobalStateReset())
                .build());
    }

    @Test
    public void startsNotReady() {
        assertFalse(newContext().isReady());
    }

    @Test
    public void markReadyTwiceFailsOnSecondCall() {
        ApplicationContext ctx = newContext();

        ctx.markReady();
        assertTrue(ctx.isReady());

        IllegalStateException e = assertThrows(IllegalStateException.class, ctx::markReady);
        assertTrue(e.getMessage().contains("already been initialized"));
        assertTrue(ctx.isReady(), "A rejected second call must not revert readiness");
    }

    @Test
    public void zeroTimeoutAfterReadyReturnsImmediately() {
        ApplicationContext ctx = newContext();
        ctx.markReady();

        assertTrue(ctx.waitForReady(0));
    }

    @Test
    public void shortTimeoutBeforeReadyReturnsFalse() {
        ApplicationContext ctx = newContext();

        long start = System.nanoTime();
        assertFalse(ctx.waitForReady(50));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs >= 40, "Expected to wait roughly the timeout, waited " + elapsedMs + "ms");
        assertFalse(ctx.waitForReady(0));
    }

    @Test
    public void defaultWaitUsesReadyTimeoutSetting() {
        ApplicationSettings settings = ApplicationSettings.builder()
                .putLong(ApplicationSettings.READY_TIMEOUT_MS_KEY, 50)
                .build();
        ApplicationContext ctx = new ApplicationContext(new CacheHelper(), ApplicationContextOptions.builder()
                .settings(settings)
                .globalStateReset(new RecordingGlobalStateReset())
                .build());

        long start = System.nanoTime();
        assertFalse(ctx.waitForReady());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertTrue(elapsedMs >= 40 && elapsedMs < 5_000, "Expected to wait about 50ms, waited " + elapsedMs + "ms");

        ctx.markReady();
        assertTrue(ctx.waitForReady());
    }

    @Test
    public void waiterBlocksUntilConcurrentMarkReady() throws Exception {
        ApplicationContext ctx = newContext();
        CountDownLatch waiting = new CountDownLatch(1);

        ExecutorService exec = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> waiter = exec.submit(() -> {
                waiting.countDown();
                return ctx.waitForReady(10_000);
            });

            assertTrue(waiting.await(2, TimeUnit.SECONDS));
            Thread.sleep(50);
            assertFalse(waiter.isDone(), "Waiter must block while the context is not ready");

            ctx.markReady();

            assertTrue(waiter.get(5, TimeUnit.SECONDS));
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    public void manyWaitersAreReleasedTogether() throws Exception {
        ApplicationContext ctx = newContext();
        int threads = 8;
        CountDownLatch started = new CountDownLatch(threads);

        ExecutorService exec = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Boolean>> waiters = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                waiters.add(exec.submit(() -> {
                    started.countDown();
                    return ctx.waitForReady(ApplicationContext.INFINITE_TIMEOUT);
                }));
            }

            assertTrue(started.await(2, TimeUnit.SECONDS));
            ctx.markReady();

            for (Future<Boolean> waiter : waiters) {
                assertTrue(waiter.get(5, TimeUnit.SECONDS));
            }
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    public void interruptedWaiterReturnsFalseAndKeepsInterruptFlag() throws Exception {
        ApplicationContext ctx = newContext();

        Thread.currentThread().interrupt();
        try {
            assertFalse(ctx.waitForReady(10_000));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void disposalClearsReadinessAndRejectsMarkReady() {
        ApplicationContext ctx = newContext();
        ctx.markReady();

        ctx.dispose();

        assertFalse(ctx.isReady());
        assertThrows(IllegalStateException.class, ctx::markReady);
        assertFalse(ctx.isReady());
    }
}
