package com.example.almanac.common;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StripedLocksTest {

    @Test
    void sameIdAlwaysUsesTheSameStripe() {
        StripedLocks locks = new StripedLocks(8);

        assertSame(locks.stripeFor(42), locks.stripeFor(42));
        assertSame(locks.stripeFor(3), locks.stripeFor(11));
        assertNotNull(locks.stripeFor(-7));
    }

    @Test
    void lockCountStaysFixedNoMatterHowManyIdsAreSeen() {
        StripedLocks locks = new StripedLocks(16);

        for (long id = 0; id < 100_000; id++) {
            locks.withLock(id, () -> { });
        }

        assertEquals(16, locks.stripeCount());
    }

    @Test
    void writersToOneIdAreSerialized() throws InterruptedException {
        StripedLocks locks = new StripedLocks(4);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(8);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 8; i++) {
                pool.execute(() -> {
                    locks.withLock(7L, () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        try {
                            Thread.sleep(5);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        inside.decrementAndGet();
                    });
                    done.countDown();
                });
            }
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxInside.get());
    }

    @Test
    void rejectsEmptyPool() {
        assertThrows(IllegalArgumentException.class, () -> new StripedLocks(0));
    }
}
