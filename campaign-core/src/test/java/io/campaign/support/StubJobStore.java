package io.campaign.support;

import io.campaign.JobEnvelope;
import io.campaign.model.JobKind;
import io.campaign.model.JobRecord;
import io.campaign.model.JobStatus;
import io.campaign.spi.JobStore;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * JobStore stub that keeps just enough state to drive the dispatcher and poller.
 *
 * <p>{@link #claim} succeeds for any job not yet finished, counting deliveries per job id.
 * Attempts recorded by {@link #markRetry} are reported on the next claim.
 */
public class StubJobStore implements JobStore {
    public final AtomicInteger insertCount = new AtomicInteger();
    public final AtomicInteger claimCount = new AtomicInteger();
    public final AtomicInteger markDoneCount = new AtomicInteger();
    public final AtomicInteger markRetryCount = new AtomicInteger();
    public final AtomicInteger markDeadCount = new AtomicInteger();
    public final AtomicInteger markDeferredCount = new AtomicInteger();
    public final AtomicReference<Instant> lastRetryNextAt = new AtomicReference<>();
    public final AtomicReference<String> lastError = new AtomicReference<>();
    public final List<JobEnvelope> inserted = new CopyOnWriteArrayList<>();
    public final List<JobRecord> pending = new CopyOnWriteArrayList<>();
    public final List<JobRecord> dead = new CopyOnWriteArrayList<>();

    private final Map<String, Integer> deliveries = new ConcurrentHashMap<>();
    private final Map<String, Integer> attempts = new ConcurrentHashMap<>();
    private final Map<String, JobStatus> finished = new ConcurrentHashMap<>();

    /** Pretends the job was already claimed {@code count} times before. */
    public void presetDeliveries(String jobId, int count) {
        deliveries.put(jobId, count);
    }

    public void presetAttempts(String jobId, int count) {
        attempts.put(jobId, count);
    }

    @Override
    public void insertNew(Connection conn, JobEnvelope job) {
        insertCount.incrementAndGet();
        inserted.add(job);
    }

    @Override
    public Optional<JobRecord> find(Connection conn, String jobId) {
        return Optional.empty();
    }

    @Override
    public Optional<JobRecord> claim(Connection conn, String jobId, String ownerId, Instant now, Instant lockExpiry) {
        claimCount.incrementAndGet();
        if (finished.containsKey(jobId)) {
            return Optional.empty();
        }
        int delivery = deliveries.merge(jobId, 1, Integer::sum);
        return Optional.of(new JobRecord(jobId, JobKind.LINK_RECIPIENTS, 1L, null, JobStatus.NEW,
                attempts.getOrDefault(jobId, 0), delivery, now, null));
    }

    @Override
    public List<JobRecord> claimPending(Connection conn, String ownerId, Instant now, Instant lockExpiry,
            Duration skipRecent, int limit) {
        List<JobRecord> batch = new ArrayList<>();
        for (JobRecord record : pending) {
            if (batch.size() >= limit) {
                break;
            }
            batch.add(record);
        }
        pending.removeAll(batch);
        return batch;
    }

    @Override
    public int markDone(Connection conn, String jobId) {
        markDoneCount.incrementAndGet();
        finished.put(jobId, JobStatus.DONE);
        return 1;
    }

    @Override
    public int markRetry(Connection conn, String jobId, Instant nextAt, String error) {
        markRetryCount.incrementAndGet();
        lastRetryNextAt.set(nextAt);
        lastError.set(error);
        attempts.merge(jobId, 1, Integer::sum);
        return 1;
    }

    @Override
    public int markDeferred(Connection conn, String jobId, Instant nextAt) {
        markDeferredCount.incrementAndGet();
        return 1;
    }

    @Override
    public int markDead(Connection conn, String jobId, String error) {
        markDeadCount.incrementAndGet();
        lastError.set(error);
        finished.put(jobId, JobStatus.DEAD);
        return 1;
    }

    @Override
    public List<JobRecord> queryDead(Connection conn, JobKind kind, int limit) {
        List<JobRecord> result = new ArrayList<>();
        for (JobRecord record : dead) {
            if ((kind == null || record.kind() == kind) && result.size() < limit) {
                result.add(record);
            }
        }
        return result;
    }

    @Override
    public int replayDead(Connection conn, String jobId) {
        return dead.removeIf(record -> record.jobId().equals(jobId)) ? 1 : 0;
    }

    @Override
    public int countDead(Connection conn, JobKind kind) {
        return (int) dead.stream().filter(record -> kind == null || record.kind() == kind).count();
    }
}
