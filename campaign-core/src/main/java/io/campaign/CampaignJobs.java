package io.campaign;

import io.campaign.dead.DeadJobManager;
import io.campaign.dispatch.DispatcherPollerHandler;
import io.campaign.dispatch.DispatcherSubmitHook;
import io.campaign.dispatch.JobDispatcher;
import io.campaign.dispatch.RetryPolicy;
import io.campaign.job.CampaignDispatchJob;
import io.campaign.job.DefaultJobHandlerRegistry;
import io.campaign.job.GroupAssignmentJob;
import io.campaign.job.RecipientLinkingJob;
import io.campaign.model.JobKind;
import io.campaign.notify.DefaultNotifierRegistry;
import io.campaign.notify.LoggingNotifier;
import io.campaign.notify.NotifierRegistry;
import io.campaign.poller.JobPoller;
import io.campaign.recipient.RecipientDirectory;
import io.campaign.spi.CampaignStore;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.GroupStore;
import io.campaign.spi.JobStore;
import io.campaign.spi.MetricsExporter;
import io.campaign.spi.RecipientStore;
import io.campaign.util.TargetCodec;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the three job handlers, a {@link JobDispatcher}, a
 * {@link JobPoller} and a {@link JobSubmitter} into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (CampaignJobs jobs = CampaignJobs.builder()
 *     .connectionProvider(connectionProvider)
 *     .recipientStore(stores.recipients())
 *     .groupStore(stores.groups())
 *     .campaignStore(stores.campaigns())
 *     .jobStore(stores.jobs())
 *     .build()) {
 *   SubmittedCampaign submitted = jobs.submitter().createCampaign("Launch", "Hello", emails);
 *   // ... once linked:
 *   jobs.submitter().submitDispatchJob(submitted.campaign().id());
 * }
 * }</pre>
 */
public final class CampaignJobs implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CampaignJobs.class.getName());

  private final JobSubmitter submitter;
  private final JobPoller poller;
  private final JobDispatcher dispatcher;
  private final DeadJobManager deadJobs;
  private final RecipientDirectory recipients;
  private final CampaignDispatchJob dispatchJob;
  private final MetricsExporter metrics;

  private CampaignJobs(JobSubmitter submitter, JobPoller poller, JobDispatcher dispatcher,
      DeadJobManager deadJobs, RecipientDirectory recipients, CampaignDispatchJob dispatchJob,
      MetricsExporter metrics) {
    this.submitter = submitter;
    this.poller = poller;
    this.dispatcher = dispatcher;
    this.deadJobs = deadJobs;
    this.recipients = recipients;
    this.dispatchJob = dispatchJob;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public JobSubmitter submitter() {
    return submitter;
  }

  public DeadJobManager deadJobs() {
    return deadJobs;
  }

  public RecipientDirectory recipients() {
    return recipients;
  }

  /**
   * The dispatch handler, for running a dispatch synchronously outside the queue.
   */
  public CampaignDispatchJob dispatchJob() {
    return dispatchJob;
  }

  /** Owner id this node writes to claimed job rows. */
  public String ownerId() {
    return dispatcher.ownerId();
  }

  /**
   * Shuts down in order: poller, dispatcher, then the metrics exporter if it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      poller.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link CampaignJobs}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private RecipientStore recipientStore;
    private GroupStore groupStore;
    private CampaignStore campaignStore;
    private JobStore jobStore;
    private NotifierRegistry notifierRegistry;
    private MetricsExporter metrics;
    private TargetCodec targetCodec;
    private RetryPolicy retryPolicy;
    private int workerCount = 4;
    private int hotQueueCapacity = 1000;
    private int coldQueueCapacity = 1000;
    private int maxAttempts = 5;
    private Duration jobTimeout = Duration.ofMinutes(5);
    private int sendConcurrency = 10;
    private Duration sendTimeout = Duration.ofSeconds(30);
    private long intervalMs = 5000;
    private int batchSize = 50;
    private Duration skipRecent;
    private String ownerId;
    private long drainTimeoutMs = 5000;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /** <p><b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder recipientStore(RecipientStore recipientStore) {
      this.recipientStore = recipientStore;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder groupStore(GroupStore groupStore) {
      this.groupStore = groupStore;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder campaignStore(CampaignStore campaignStore) {
      this.campaignStore = campaignStore;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * Sets where dispatch looks up its notifier.
     *
     * <p>Optional. Defaults to a {@link DefaultNotifierRegistry} holding a
     * {@link LoggingNotifier} on the {@code email} channel.
     */
    public Builder notifierRegistry(NotifierRegistry notifierRegistry) {
      this.notifierRegistry = notifierRegistry;
      return this;
    }

    /** <p>Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the composite if closeable. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** <p>Optional. Defaults to {@link TargetCodec#getDefault()}. */
    public Builder targetCodec(TargetCodec targetCodec) {
      this.targetCodec = targetCodec;
      return this;
    }

    /** <p>Optional. Defaults to exponential backoff from 500 ms up to 60 s. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** <p>Optional. Defaults to {@code 4}. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** <p>Optional. Defaults to {@code 1000}. */
    public Builder hotQueueCapacity(int hotQueueCapacity) {
      this.hotQueueCapacity = hotQueueCapacity;
      return this;
    }

    /** <p>Optional. Defaults to {@code 1000}. */
    public Builder coldQueueCapacity(int coldQueueCapacity) {
      this.coldQueueCapacity = coldQueueCapacity;
      return this;
    }

    /** <p>Optional. Defaults to {@code 5}. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the per-run handler timeout, which is also the claim lock timeout.
     *
     * <p>Optional. Defaults to 5 minutes.
     */
    public Builder jobTimeout(Duration jobTimeout) {
      this.jobTimeout = jobTimeout;
      return this;
    }

    /** <p>Optional. Defaults to {@code 10} concurrent sends per dispatch. */
    public Builder sendConcurrency(int sendConcurrency) {
      this.sendConcurrency = sendConcurrency;
      return this;
    }

    /** <p>Optional. Defaults to 30 seconds per notifier call. */
    public Builder sendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
      return this;
    }

    /** <p>Optional. Defaults to {@code 5000} ms. */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /** <p>Optional. Defaults to {@code 50}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** <p>Optional. Defaults to {@link Duration#ZERO}. */
    public Builder skipRecent(Duration skipRecent) {
      this.skipRecent = skipRecent;
      return this;
    }

    /** <p>Optional. Defaults to {@code node-} followed by a random suffix. */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    /** <p>Optional. Defaults to {@code 5000} ms. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds and starts the dispatcher and poller. If the poller cannot be built or started,
     * the dispatcher is closed before rethrowing.
     *
     * @throws NullPointerException  if a required store or the connection provider is missing
     * @throws IllegalStateException if called twice on the same builder
     */
    public CampaignJobs build() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(recipientStore, "recipientStore");
      Objects.requireNonNull(groupStore, "groupStore");
      Objects.requireNonNull(campaignStore, "campaignStore");
      Objects.requireNonNull(jobStore, "jobStore");
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }

      NotifierRegistry notifiers = notifierRegistry;
      if (notifiers == null) {
        notifiers = new DefaultNotifierRegistry().register(new LoggingNotifier());
        logger.info("No notifier registry configured; campaign messages will only be logged");
      }
      MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;
      String owner = ownerId != null ? ownerId : "node-" + UUID.randomUUID().toString().substring(0, 8);

      CampaignDispatchJob dispatchJob = CampaignDispatchJob.builder()
          .connectionProvider(connectionProvider)
          .campaignStore(campaignStore)
          .recipientStore(recipientStore)
          .notifierRegistry(notifiers)
          .sendConcurrency(sendConcurrency)
          .sendTimeout(sendTimeout)
          .metrics(exporter)
          .build();
      DefaultJobHandlerRegistry handlers = new DefaultJobHandlerRegistry()
          .register(JobKind.LINK_RECIPIENTS, new RecipientLinkingJob(connectionProvider, recipientStore, campaignStore))
          .register(JobKind.DISPATCH_CAMPAIGN, dispatchJob)
          .register(JobKind.ASSIGN_GROUP, new GroupAssignmentJob(connectionProvider, recipientStore, groupStore));

      JobDispatcher.Builder db = JobDispatcher.builder()
          .connectionProvider(connectionProvider)
          .jobStore(jobStore)
          .handlerRegistry(handlers)
          .workerCount(workerCount)
          .hotQueueCapacity(hotQueueCapacity)
          .coldQueueCapacity(coldQueueCapacity)
          .maxAttempts(maxAttempts)
          .jobTimeout(jobTimeout)
          .ownerId(owner)
          .metrics(exporter)
          .drainTimeoutMs(drainTimeoutMs);
      if (retryPolicy != null) {
        db.retryPolicy(retryPolicy);
      }
      JobDispatcher dispatcher = db.build();

      JobPoller poller;
      try {
        poller = JobPoller.builder()
            .connectionProvider(connectionProvider)
            .jobStore(jobStore)
            .handler(new DispatcherPollerHandler(dispatcher))
            .batchSize(batchSize)
            .intervalMs(intervalMs)
            .skipRecent(skipRecent)
            .metrics(exporter)
            .targetCodec(targetCodec)
            .claimLocking(owner, jobTimeout)
            .build();
      } catch (RuntimeException e) {
        dispatcher.close();
        throw e;
      }
      try {
        poller.start();
      } catch (RuntimeException e) {
        poller.close();
        dispatcher.close();
        throw e;
      }

      JobSubmitter submitter = new JobSubmitter(connectionProvider, jobStore, campaignStore, groupStore,
          new DispatcherSubmitHook(dispatcher, exporter));
      DeadJobManager deadJobs = new DeadJobManager(connectionProvider, jobStore);
      RecipientDirectory recipients = new RecipientDirectory(connectionProvider, recipientStore, groupStore,
          campaignStore);
      return new CampaignJobs(submitter, poller, dispatcher, deadJobs, recipients, dispatchJob, exporter);
    }
  }
}
