package io.campaign.dispatch;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker with optional time-based expiry.
 *
 * <p>When {@code ttlMs} is zero (the default), a target stays held until released. When
 * positive, a hold older than the TTL can be taken over, which recovers from a worker that
 * died without releasing.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
    private final Map<String, Hold> inflight = new ConcurrentHashMap<>();
    private final long ttlMs;
    private final AtomicInteger evictCounter = new AtomicInteger();

    public DefaultInFlightTracker() {
        this(0L);
    }

    /**
     * @param ttlMs time-to-live in milliseconds for a hold; {@code 0} disables expiry
     */
    public DefaultInFlightTracker(long ttlMs) {
        if (ttlMs < 0) {
            throw new IllegalArgumentException("ttlMs must be >= 0, got: " + ttlMs);
        }
        this.ttlMs = ttlMs;
    }

    @Override
    public Acquisition tryAcquire(String targetKey, String jobId) {
        Objects.requireNonNull(targetKey, "targetKey");
        Objects.requireNonNull(jobId, "jobId");
        long now = System.currentTimeMillis();
        maybeEvictExpired(now);
        for (int attempt = 0; attempt < 10; attempt++) {
            Hold fresh = new Hold(jobId, now);
            Hold existing = inflight.putIfAbsent(targetKey, fresh);
            if (existing == null) {
                return Acquisition.ACQUIRED;
            }
            if (ttlMs > 0 && now - existing.acquiredAt() > ttlMs) {
                if (inflight.replace(targetKey, existing, fresh)) {
                    return Acquisition.ACQUIRED;
                }
                now = System.currentTimeMillis();
                continue;
            }
            return existing.jobId().equals(jobId) ? Acquisition.DUPLICATE : Acquisition.BUSY;
        }
        return Acquisition.BUSY;
    }

    private void maybeEvictExpired(long now) {
        if (ttlMs <= 0) return;
        // sample roughly every 1024 acquires
        if ((evictCounter.incrementAndGet() & 0x3FF) != 0) return;
        inflight.values().removeIf(hold -> now - hold.acquiredAt() > ttlMs * 2);
    }

    @Override
    public void release(String targetKey, String jobId) {
        inflight.computeIfPresent(targetKey, (key, hold) -> hold.jobId().equals(jobId) ? null : hold);
    }

    @Override
    public int size() {
        return inflight.size();
    }

    private record Hold(String jobId, long acquiredAt) {}
}
