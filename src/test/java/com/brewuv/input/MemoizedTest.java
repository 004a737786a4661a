package com.brewuv.input;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoizedTest {

    @Test
    void concurrentCallersShareOneComputation() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        Memoized<Object> memoized = new Memoized<>(() -> {
            calls.incrementAndGet();
            sleep(50);
            return new Object();
        });

        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return memoized.get();
                }));
            }
            start.countDown();
            Object first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<Object> future : futures) {
                assertSame(first, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, calls.get());
        assertTrue(memoized.isDone());
    }

    @Test
    void failureIsStoredAndRethrown() {
        AtomicInteger calls = new AtomicInteger();
        Memoized<String> memoized = new Memoized<>(() -> {
            calls.incrementAndGet();
            throw new DataUnavailableException("ozone", List.of("file:B17319.033:FILE_MISSING"));
        });

        DataUnavailableException first = assertThrows(DataUnavailableException.class, memoized::get);
        DataUnavailableException second = assertThrows(DataUnavailableException.class, memoized::get);

        assertSame(first, second);
        assertEquals(1, calls.get());
    }

    @Test
    void nothingIsComputedBeforeFirstGet() {
        AtomicInteger calls = new AtomicInteger();
        Memoized<Integer> memoized = new Memoized<>(calls::incrementAndGet);

        assertFalse(memoized.isDone());
        assertEquals(0, calls.get());
        assertEquals(1, memoized.get());
        assertEquals(1, memoized.get());
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
