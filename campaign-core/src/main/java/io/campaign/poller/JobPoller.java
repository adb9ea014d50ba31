package io.campaign.poller;

import io.campaign.JobEnvelope;
import io.campaign.model.JobRecord;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.JobStore;
import io.campaign.spi.MetricsExporter;
import io.campaign.util.DaemonThreadFactory;
import io.campaign.util.TargetCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled scanner that claims pending jobs from the store and hands them to a
 * {@link JobPollerHandler}. It picks up jobs the hot path dropped, retries whose backoff has
 * elapsed, deferred jobs, and jobs whose previous owner stopped reporting back.
 *
 * <p>Rows are claimed with {@code ownerId} so several nodes can share one database; a claim
 * lapses after {@code lockTimeout}. A row whose address payload cannot be decoded is marked
 * DEAD.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #close()} are
 * synchronized.
 */
public final class JobPoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JobPoller.class.getName());

    private final ConnectionProvider connectionProvider;
    private final JobStore jobStore;
    private final JobPollerHandler handler;
    private final Duration skipRecent;
    private final int batchSize;
    private final long intervalMs;
    private final MetricsExporter metrics;
    private final String ownerId;
    private final Duration lockTimeout;
    private final TargetCodec targetCodec;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private JobPoller(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
        this.handler = Objects.requireNonNull(builder.handler, "handler");
        this.ownerId = Objects.requireNonNull(builder.ownerId, "ownerId");
        this.lockTimeout = Objects.requireNonNull(builder.lockTimeout, "lockTimeout");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.skipRecent != null && builder.skipRecent.isNegative()) {
            throw new IllegalArgumentException("skipRecent must be >= 0");
        }
        if (lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive");
        }

        this.skipRecent = builder.skipRecent == null ? Duration.ZERO : builder.skipRecent;
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.targetCodec = builder.targetCodec != null ? builder.targetCodec : TargetCodec.getDefault();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled polling loop. Subsequent calls are no-ops.
     *
     * @throws IllegalStateException if the poller has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("JobPoller has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("campaign-poller-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Runs a single poll cycle. Called by the scheduler; tests may call it directly.
     */
    public void poll() {
        if (closed) {
            return;
        }
        try {
            if (handler.availableCapacity() <= 0) {
                return;
            }
            Instant now = Instant.now();
            List<JobRecord> rows = claimRows(now);
            if (rows == null) {
                return; // fetch failed, keep the last lag reading
            }
            if (rows.isEmpty()) {
                metrics.recordOldestLagMs(0);
                return;
            }
            // rows come back oldest first
            Instant oldest = rows.get(0).createdAt();
            for (JobRecord row : rows) {
                if (!forward(row)) {
                    break;
                }
            }
            if (oldest != null) {
                metrics.recordOldestLagMs(Math.max(0L, Duration.between(oldest, now).toMillis()));
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Poll cycle failed", t);
        }
    }

    /**
     * Returns {@code null} on failure to tell it apart from an empty batch.
     */
    private List<JobRecord> claimRows(Instant now) {
        int effectiveBatch = Math.min(batchSize, handler.availableCapacity());
        if (effectiveBatch <= 0) {
            return List.of();
        }
        try (Connection conn = connectionProvider.getConnection()) {
            // UPDATE then SELECT, in one transaction
            conn.setAutoCommit(false);
            try {
                List<JobRecord> claimed = jobStore.claimPending(conn, ownerId, now, now.minus(lockTimeout),
                        skipRecent, effectiveBatch);
                conn.commit();
                return claimed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to claim pending jobs", e);
            return null;
        }
    }

    private boolean forward(JobRecord row) {
        JobEnvelope job;
        try {
            job = JobEnvelope.builder(row.kind())
                    .jobId(row.jobId())
                    .targetId(row.targetId())
                    .occurredAt(row.createdAt())
                    .targets(targetCodec.parse(row.payloadJson()))
                    .build();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to decode job row jobId=" + row.jobId(), e);
            markDead(row.jobId(), e);
            return true;
        }
        boolean accepted = handler.handle(job);
        if (accepted) {
            metrics.incrementColdEnqueued();
        }
        return accepted;
    }

    private void markDead(String jobId, Exception failure) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            jobStore.markDead(conn, jobId, "Undecodable job row: " + failure.getMessage());
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to mark DEAD for jobId=" + jobId, e);
        }
    }

    /**
     * Cancels the schedule and stops the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link JobPoller}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private JobStore jobStore;
        private JobPollerHandler handler;
        private Duration skipRecent;
        private int batchSize = 50;
        private long intervalMs = 5000;
        private MetricsExporter metrics;
        private String ownerId;
        private Duration lockTimeout;
        private TargetCodec targetCodec;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param jobStore the store pending jobs are claimed from
         * @return this builder
         */
        public Builder jobStore(JobStore jobStore) {
            this.jobStore = jobStore;
            return this;
        }

        /**
         * Sets the receiver of claimed jobs, typically a
         * {@link io.campaign.dispatch.DispatcherPollerHandler}.
         *
         * <p><b>Required.</b>
         *
         * @param handler the callback for polled jobs
         * @return this builder
         */
        public Builder handler(JobPollerHandler handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Sets how long the poller leaves a freshly submitted job to the hot path.
         *
         * <p>Optional. Defaults to {@link Duration#ZERO}. Must be &ge; 0.
         *
         * @param skipRecent grace period for new jobs
         * @return this builder
         */
        public Builder skipRecent(Duration skipRecent) {
            this.skipRecent = skipRecent;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
         *
         * @param batchSize maximum rows claimed per cycle
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
         *
         * @param intervalMs delay between the end of one cycle and the start of the next
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics exporter for lag and cold-enqueue counters
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the claim identity for this node and how long a claim holds.
         *
         * <p><b>Required.</b> Use the same owner id as the node's dispatcher so jobs claimed
         * here can be run there.
         *
         * @param ownerId     unique identifier for this node
         * @param lockTimeout age after which a claimed row may be claimed again
         * @return this builder
         */
        public Builder claimLocking(String ownerId, Duration lockTimeout) {
            this.ownerId = ownerId;
            this.lockTimeout = lockTimeout;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link TargetCodec#getDefault()}.
         *
         * @param targetCodec codec for the address payload column
         * @return this builder
         */
        public Builder targetCodec(TargetCodec targetCodec) {
            this.targetCodec = targetCodec;
            return this;
        }

        /**
         * Builds the poller. Call {@link JobPoller#start()} to begin polling.
         *
         * @return a new {@link JobPoller}
         * @throws NullPointerException     if a required setting is missing
         * @throws IllegalArgumentException if {@code batchSize <= 0}, {@code intervalMs <= 0},
         *                                  {@code skipRecent} is negative or
         *                                  {@code lockTimeout} is not positive
         */
        public JobPoller build() {
            return new JobPoller(this);
        }
    }
}
