package io.campaign.dispatch;

import io.campaign.CampaignException;
import io.campaign.JobEnvelope;
import io.campaign.job.JobExecution;
import io.campaign.job.JobHandler;
import io.campaign.job.JobHandlerRegistry;
import io.campaign.model.JobRecord;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.JobStore;
import io.campaign.spi.MetricsExporter;
import io.campaign.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dual-queue job processor that runs queued jobs through their registered {@link JobHandler}.
 *
 * <p>Jobs arrive via two paths: the <em>hot queue</em> (right after a submit commits) and the
 * <em>cold queue</em> (poller fallback). Worker threads drain both queues using a weighted 2:1
 * round-robin favoring the hot queue.
 *
 * <p>Before running a job a worker:
 * <ol>
 *   <li>takes the job's target (campaign or group) in the {@link InFlightTracker}; a copy of
 *       a job already running is dropped, and a job whose target is busy with another job is
 *       deferred in the store for a later poll;</li>
 *   <li>claims the row in the store, which increments its delivery counter and fails if the
 *       job already finished or another node holds it.</li>
 * </ol>
 *
 * <p>The handler runs on a separate runner thread bounded by {@code jobTimeout}. On success
 * the job is DONE. A {@link CampaignException} (including {@link UnroutableJobException})
 * marks it DEAD at once; any other failure or a timeout is retried with backoff until
 * {@code maxAttempts} runs have failed, after which it is DEAD and the handler's
 * {@link JobHandler#onExhausted} is called.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @see DispatcherSubmitHook
 * @see DispatcherPollerHandler
 */
public final class JobDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobDispatcher.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<QueuedJob> hotQueue;
  private final BlockingQueue<QueuedJob> coldQueue;
  private final ExecutorService workers;
  private final ExecutorService runners;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicInteger pollCounter = new AtomicInteger(0);

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final JobHandlerRegistry handlerRegistry;
  private final InFlightTracker inFlightTracker;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final Duration jobTimeout;
  private final String ownerId;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;

  private JobDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.ownerId = builder.ownerId != null
        ? builder.ownerId : "node-" + UUID.randomUUID().toString().substring(0, 8);
    this.drainTimeoutMs = builder.drainTimeoutMs;

    int workerCount = builder.workerCount;
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (builder.hotQueueCapacity <= 0 || builder.coldQueueCapacity <= 0) {
      throw new IllegalArgumentException("Queue capacities must be > 0");
    }
    Objects.requireNonNull(builder.jobTimeout, "jobTimeout");
    if (builder.jobTimeout.isNegative() || builder.jobTimeout.isZero()) {
      throw new IllegalArgumentException("jobTimeout must be positive");
    }
    this.maxAttempts = builder.maxAttempts;
    this.jobTimeout = builder.jobTimeout;

    this.hotQueue = new ArrayBlockingQueue<>(builder.hotQueueCapacity);
    this.coldQueue = new ArrayBlockingQueue<>(builder.coldQueueCapacity);
    this.runners = Executors.newCachedThreadPool(new DaemonThreadFactory("campaign-job-runner-"));

    if (workerCount > 0) {
      this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("campaign-dispatcher-"));
      for (int i = 0; i < workerCount; i++) {
        workers.submit(this::workerLoop);
      }
    } else {
      logger.warning("workerCount=0: no dispatch workers started; jobs will not be processed");
      this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("campaign-dispatcher-"));
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Offers a job to the hot queue. Returns {@code false} if the queue is full or the
   * dispatcher is shutting down.
   */
  public boolean enqueueHot(QueuedJob job) {
    if (!accepting.get()) return false;
    boolean enqueued = hotQueue.offer(job);
    metrics.recordQueueDepths(hotQueue.size(), coldQueue.size());
    return enqueued;
  }

  /**
   * Offers a job to the cold queue. Returns {@code false} if the queue is full or the
   * dispatcher is shutting down.
   */
  public boolean enqueueCold(QueuedJob job) {
    if (!accepting.get()) return false;
    boolean enqueued = coldQueue.offer(job);
    metrics.recordQueueDepths(hotQueue.size(), coldQueue.size());
    return enqueued;
  }

  public int coldQueueRemainingCapacity() {
    return coldQueue.remainingCapacity();
  }

  /** Identifier written to {@code locked_by} when this node claims a job. */
  public String ownerId() {
    return ownerId;
  }

  public Duration jobTimeout() {
    return jobTimeout;
  }

  private QueuedJob pollFairly() throws InterruptedException {
    int cycle = pollCounter.getAndIncrement();
    BlockingQueue<QueuedJob> primary;
    BlockingQueue<QueuedJob> secondary;
    // mask the sign bit so the cycle stays non-negative after overflow
    if ((cycle & 0x7FFFFFFF) % 3 == 2) {
      primary = coldQueue;
      secondary = hotQueue;
    } else {
      primary = hotQueue;
      secondary = coldQueue;
    }
    QueuedJob job = primary.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    if (job == null) {
      job = secondary.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    }
    return job;
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && hotQueue.isEmpty() && coldQueue.isEmpty()) {
          break;
        }
        QueuedJob queued = pollFairly();
        if (queued == null) {
          if (!running.get()) break;
          continue;
        }
        dispatchJob(queued);
        metrics.recordQueueDepths(hotQueue.size(), coldQueue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Dispatcher loop error", t);
      }
    }
  }

  private void dispatchJob(QueuedJob queued) throws InterruptedException {
    JobEnvelope job = queued.job();
    String targetKey = job.targetKey();
    switch (inFlightTracker.tryAcquire(targetKey, job.jobId())) {
      case DUPLICATE:
        logger.fine("Dropping duplicate delivery of running job " + job.jobId());
        return;
      case BUSY:
        defer(job);
        return;
      default:
        break;
    }
    try {
      Optional<JobRecord> claimed = claim(job.jobId());
      if (claimed.isEmpty()) {
        logger.fine("Job " + job.jobId() + " (" + queued.source() + ") is finished or held elsewhere; skipping");
        return;
      }
      JobRecord record = claimed.get();
      runClaimed(new JobExecution(job, record.attempts(), record.deliveries()));
    } finally {
      inFlightTracker.release(targetKey, job.jobId());
    }
  }

  private void runClaimed(JobExecution execution) throws InterruptedException {
    JobEnvelope job = execution.job();
    long started = System.nanoTime();
    try {
      JobHandler handler = handlerRegistry.handlerFor(job.kind());
      if (handler == null) {
        throw new UnroutableJobException("No handler registered for kind=" + job.kind());
      }
      try {
        runWithTimeout(handler, execution);
        markDone(job.jobId());
        metrics.incrementJobSuccess();
      } catch (InterruptedException e) {
        throw e;
      } catch (Exception e) {
        handleFailure(execution, handler, e);
      }
    } catch (UnroutableJobException e) {
      handleFailure(execution, null, e);
    } finally {
      metrics.recordJobDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    }
  }

  private void runWithTimeout(JobHandler handler, JobExecution execution) throws Exception {
    Future<?> future = runners.submit(() -> {
      handler.handle(execution);
      return null;
    });
    try {
      future.get(jobTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new TimeoutException("Job " + execution.job().jobId() + " exceeded timeout of "
          + jobTimeout.toMillis() + " ms");
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception ex) {
        throw ex;
      }
      throw e;
    }
  }

  private void handleFailure(JobExecution execution, JobHandler handler, Exception failure) {
    JobEnvelope job = execution.job();
    String jobId = job.jobId();
    if (failure instanceof CampaignException) {
      markDead(jobId, failure);
      metrics.incrementJobDead();
      logger.log(Level.SEVERE, "Job " + jobId + " (" + job.kind() + ") failed permanently, marked DEAD", failure);
      return;
    }

    int nextAttempt = execution.attempts() + 1;
    if (nextAttempt >= maxAttempts) {
      markDead(jobId, failure);
      metrics.incrementJobDead();
      logger.log(Level.SEVERE, "Job " + jobId + " (" + job.kind() + ") moved to DEAD after "
          + nextAttempt + " attempts", failure);
      if (handler != null) {
        try {
          handler.onExhausted(job, failure);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "onExhausted failed for job " + jobId, e);
        }
      }
    } else {
      long delayMs = retryPolicy.computeDelayMs(nextAttempt);
      markRetry(jobId, Instant.now().plusMillis(delayMs), failure);
      metrics.incrementJobRetry();
      logger.log(Level.WARNING, "Job " + jobId + " (" + job.kind() + ") failed on attempt " + nextAttempt
          + ", retrying in " + delayMs + " ms: " + failure);
    }
  }

  private void defer(JobEnvelope job) {
    long delayMs = retryPolicy.computeDelayMs(1);
    Instant nextAt = Instant.now().plusMillis(delayMs);
    withConnection("defer", job.jobId(), conn -> jobStore.markDeferred(conn, job.jobId(), nextAt));
    metrics.incrementJobDeferred();
    logger.fine("Target " + job.targetKey() + " busy; deferred job " + job.jobId() + " by " + delayMs + " ms");
  }

  private Optional<JobRecord> claim(String jobId) {
    Instant now = Instant.now();
    Instant lockExpiry = now.minus(jobTimeout);
    try (Connection conn = connectionProvider.getConnection()) {
      // claim is UPDATE then SELECT; both must see the same transaction
      conn.setAutoCommit(false);
      try {
        Optional<JobRecord> claimed = jobStore.claim(conn, jobId, ownerId, now, lockExpiry);
        conn.commit();
        return claimed;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to claim job " + jobId + "; leaving it for the poller", e);
      return Optional.empty();
    }
  }

  private void markDone(String jobId) {
    withConnection("mark DONE", jobId, conn -> jobStore.markDone(conn, jobId));
  }

  private void markRetry(String jobId, Instant nextAt, Exception failure) {
    withConnection("mark RETRY", jobId,
        conn -> jobStore.markRetry(conn, jobId, nextAt, describe(failure)));
  }

  private void markDead(String jobId, Exception failure) {
    withConnection("mark DEAD", jobId, conn -> jobStore.markDead(conn, jobId, describe(failure)));
  }

  private void withConnection(String action, String jobId, SqlAction op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      op.execute(conn);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for jobId=" + jobId, e);
    }
  }

  private static String describe(Exception failure) {
    if (failure == null) {
      return null;
    }
    return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
  }

  @FunctionalInterface
  private interface SqlAction {
    void execute(Connection conn) throws SQLException;
  }

  /**
   * Initiates graceful shutdown: stops accepting jobs, drains the queues within the
   * configured drain timeout, then shuts down worker and runner threads. Jobs left in the
   * queues stay pending in the store.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. "
            + "Hot remaining: " + hotQueue.size() + ", Cold remaining: " + coldQueue.size());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      runners.shutdownNow();
    }
  }

  /** Builder for {@link JobDispatcher}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private JobHandlerRegistry handlerRegistry;
    private InFlightTracker inFlightTracker;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 5;
    private int workerCount = 4;
    private int hotQueueCapacity = 1000;
    private int coldQueueCapacity = 1000;
    private Duration jobTimeout = Duration.ofMinutes(5);
    private String ownerId;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the connection provider used to claim jobs and record their outcome.
     *
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
     * Sets the job store used to claim jobs and write DONE, RETRY and DEAD.
     *
     * <p><b>Required.</b>
     *
     * @param jobStore the persistence backend
     * @return this builder
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * Sets the registry mapping each {@link io.campaign.model.JobKind} to its handler.
     *
     * <p><b>Required.</b>
     *
     * @param handlerRegistry the handler registry
     * @return this builder
     */
    public Builder handlerRegistry(JobHandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link DefaultInFlightTracker} without expiry.
     *
     * @param inFlightTracker the tracker implementation
     * @return this builder
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Sets the policy computing the delay before a failed job is retried. The first-attempt
     * delay is also used to defer jobs whose target is busy.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=500} and {@code maxDelayMs=60000}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the number of failed runs after which a job is marked DEAD.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param maxAttempts maximum attempts per job
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the number of worker threads that drain the queues.
     *
     * <p>Optional. Defaults to {@code 4}. Setting {@code 0} disables processing
     * (testing only).
     *
     * @param workerCount number of worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param hotQueueCapacity maximum number of jobs in the hot queue
     * @return this builder
     */
    public Builder hotQueueCapacity(int hotQueueCapacity) {
      this.hotQueueCapacity = hotQueueCapacity;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param coldQueueCapacity maximum number of jobs in the cold queue
     * @return this builder
     */
    public Builder coldQueueCapacity(int coldQueueCapacity) {
      this.coldQueueCapacity = coldQueueCapacity;
      return this;
    }

    /**
     * Sets the time budget for one handler run. A run exceeding it is interrupted and
     * counted as a failed attempt. The same duration is the lock timeout after which a
     * claimed job may be reclaimed by another node.
     *
     * <p>Optional. Defaults to 5 minutes. Must be positive.
     *
     * @param jobTimeout per-run timeout
     * @return this builder
     */
    public Builder jobTimeout(Duration jobTimeout) {
      this.jobTimeout = jobTimeout;
      return this;
    }

    /**
     * Sets the identifier written to claimed rows. Must match the poller's owner id on
     * this node.
     *
     * <p>Optional. Defaults to {@code node-} followed by a random suffix.
     *
     * @param ownerId unique identifier for this node
     * @return this builder
     */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds to wait for queued jobs during shutdown.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds and starts the dispatcher. Worker threads begin draining queues immediately.
     *
     * @return a new {@link JobDispatcher}
     * @throws NullPointerException     if {@code connectionProvider}, {@code jobStore} or
     *                                  {@code handlerRegistry} is null
     * @throws IllegalArgumentException if {@code maxAttempts < 1}, {@code workerCount < 0},
     *                                  a queue capacity is &le; 0 or {@code jobTimeout} is
     *                                  not positive
     */
    public JobDispatcher build() {
      return new JobDispatcher(this);
    }
  }
}
