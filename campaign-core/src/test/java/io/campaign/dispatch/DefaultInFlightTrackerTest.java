package io.campaign.dispatch;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultInFlightTrackerTest {

    @Test
    void firstAcquireWinsAndOthersSeeBusy() {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();

        assertEquals(InFlightTracker.Acquisition.ACQUIRED, tracker.tryAcquire("campaign:1", "job-a"));
        assertEquals(InFlightTracker.Acquisition.BUSY, tracker.tryAcquire("campaign:1", "job-b"));
        assertEquals(InFlightTracker.Acquisition.DUPLICATE, tracker.tryAcquire("campaign:1", "job-a"));
        assertEquals(InFlightTracker.Acquisition.ACQUIRED, tracker.tryAcquire("campaign:2", "job-b"));
        assertEquals(2, tracker.size());
    }

    @Test
    void releaseFreesTheTarget() {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();
        tracker.tryAcquire("campaign:1", "job-a");

        tracker.release("campaign:1", "job-a");

        assertEquals(0, tracker.size());
        assertEquals(InFlightTracker.Acquisition.ACQUIRED, tracker.tryAcquire("campaign:1", "job-b"));
    }

    @Test
    void releaseByAnotherJobKeepsTheHold() {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();
        tracker.tryAcquire("campaign:1", "job-a");

        tracker.release("campaign:1", "job-b");

        assertEquals(InFlightTracker.Acquisition.BUSY, tracker.tryAcquire("campaign:1", "job-c"));
    }

    @Test
    void expiredHoldCanBeTakenOver() throws Exception {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker(50);
        tracker.tryAcquire("campaign:1", "job-a");

        Thread.sleep(120);

        assertEquals(InFlightTracker.Acquisition.ACQUIRED, tracker.tryAcquire("campaign:1", "job-b"));
        tracker.release("campaign:1", "job-a");
        assertEquals(InFlightTracker.Acquisition.BUSY, tracker.tryAcquire("campaign:1", "job-c"));
    }

    @Test
    void onlyOneConcurrentAcquirerWins() throws Exception {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();
        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int i = 0; i < threads; i++) {
                String jobId = "job-" + i;
                pool.submit(() -> {
                    start.await();
                    if (tracker.tryAcquire("group:7", jobId) == InFlightTracker.Acquisition.ACQUIRED) {
                        winners.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }
        assertEquals(1, winners.get());
    }

    @Test
    void rejectsNegativeTtlAndNullKeys() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultInFlightTracker(-1));
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();
        assertThrows(NullPointerException.class, () -> tracker.tryAcquire(null, "job"));
        assertThrows(NullPointerException.class, () -> tracker.tryAcquire("campaign:1", null));
    }
}
