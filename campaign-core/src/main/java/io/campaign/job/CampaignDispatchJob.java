package io.campaign.job;

import io.campaign.InvalidStateTransitionException;
import io.campaign.JobEnvelope;
import io.campaign.NotFoundException;
import io.campaign.dispatch.UnroutableJobException;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.DeliveryFailure;
import io.campaign.model.DispatchReport;
import io.campaign.model.Recipient;
import io.campaign.notify.Notifier;
import io.campaign.notify.NotifierRegistry;
import io.campaign.notify.SendResult;
import io.campaign.spi.CampaignStore;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.MetricsExporter;
import io.campaign.spi.RecipientStore;
import io.campaign.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends a campaign to every eligible linked recipient and records the outcome.
 *
 * <p>Only a {@code ready} or {@code send_failed} campaign may be dispatched; anything else
 * fails with {@link InvalidStateTransitionException} before a single send. The campaign is
 * held in {@code sending} while notifier calls run. A redelivered dispatch may resume a
 * campaign left in {@code sending}, and one that finds it already {@code sent} does nothing.
 * A campaign in {@code processing} is being linked and is always rejected.
 *
 * <p>Notifier calls run on at most {@code sendConcurrency} threads, each bounded by
 * {@code sendTimeout}. A timeout, an exception or an unsuccessful {@link SendResult} counts as
 * a failure for that recipient only. When all calls are done the failure list is replaced and
 * the status is written once: {@code sent} if nothing failed (including zero eligible
 * recipients), {@code send_failed} otherwise. Failed recipients are not retried
 * automatically; re-dispatching a {@code send_failed} campaign sends to everyone again.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class CampaignDispatchJob implements JobHandler {
  private static final Logger logger = Logger.getLogger(CampaignDispatchJob.class.getName());

  private final ConnectionProvider connectionProvider;
  private final CampaignStore campaignStore;
  private final RecipientStore recipientStore;
  private final NotifierRegistry notifierRegistry;
  private final String channel;
  private final int sendConcurrency;
  private final Duration sendTimeout;
  private final MetricsExporter metrics;

  private CampaignDispatchJob(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.campaignStore = Objects.requireNonNull(builder.campaignStore, "campaignStore");
    this.recipientStore = Objects.requireNonNull(builder.recipientStore, "recipientStore");
    this.notifierRegistry = Objects.requireNonNull(builder.notifierRegistry, "notifierRegistry");
    this.channel = builder.channel != null ? builder.channel : notifierRegistry.defaultChannel();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (builder.sendConcurrency < 1) {
      throw new IllegalArgumentException("sendConcurrency must be >= 1");
    }
    Objects.requireNonNull(builder.sendTimeout, "sendTimeout");
    if (builder.sendTimeout.isNegative() || builder.sendTimeout.isZero()) {
      throw new IllegalArgumentException("sendTimeout must be positive");
    }
    this.sendConcurrency = builder.sendConcurrency;
    this.sendTimeout = builder.sendTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void handle(JobExecution execution) throws SQLException, InterruptedException {
    JobEnvelope job = execution.job();
    DispatchReport report = dispatch(job.targetId(), execution.isRedelivery());
    logger.info("Dispatched campaign " + report.campaignId() + ": " + report.sent() + "/" + report.eligible()
        + " delivered, status=" + report.status().code() + " (jobId=" + job.jobId() + ")");
  }

  /**
   * Dispatches a campaign synchronously on the calling thread.
   *
   * @param campaignId the campaign to send
   * @return the outcome, including the final status
   * @throws NotFoundException               if the campaign does not exist
   * @throws InvalidStateTransitionException if the campaign is not ready or send_failed
   * @throws UnroutableJobException          if no notifier is registered for the channel
   * @throws SQLException                    if a connection cannot be obtained
   * @throws InterruptedException            if interrupted while waiting for sends
   */
  public DispatchReport dispatch(long campaignId) throws SQLException, InterruptedException {
    return dispatch(campaignId, false);
  }

  private DispatchReport dispatch(long campaignId, boolean redelivery)
      throws SQLException, InterruptedException {
    Notifier notifier = notifierRegistry.notifierFor(channel);
    if (notifier == null) {
      throw new UnroutableJobException("No notifier registered for channel=" + channel);
    }

    Campaign campaign;
    List<Recipient> eligible;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      campaign = startSending(conn, campaignId, redelivery);
      if (campaign == null) {
        logger.info("Campaign " + campaignId + " was already sent; nothing to redeliver");
        return new DispatchReport(campaignId, 0, 0, List.of(), CampaignStatus.SENT);
      }
      eligible = recipientStore.listEligible(conn, campaignId);
    }

    List<DeliveryFailure> failures = sendAll(notifier, campaign, eligible);
    CampaignStatus outcome = failures.isEmpty() ? CampaignStatus.SENT : CampaignStatus.SEND_FAILED;
    finish(campaignId, failures, outcome);
    return new DispatchReport(campaignId, eligible.size(), eligible.size() - failures.size(), failures, outcome);
  }

  /**
   * Moves the campaign to {@code sending}. Returns {@code null} when a redelivery finds the
   * campaign already sent.
   */
  private Campaign startSending(Connection conn, long campaignId, boolean redelivery) {
    Campaign campaign = campaignStore.get(conn, campaignId)
        .orElseThrow(() -> new NotFoundException("Campaign", campaignId));
    if (redelivery && campaign.status() == CampaignStatus.SENT) {
      return null;
    }
    Set<CampaignStatus> allowed = CampaignStatus.dispatchable();
    if (redelivery) {
      allowed.add(CampaignStatus.SENDING);
    }
    if (!allowed.contains(campaign.status())) {
      throw new InvalidStateTransitionException(campaignId, campaign.status(), CampaignStatus.SENDING);
    }
    if (campaignStore.compareAndSetStatus(conn, campaignId, allowed, CampaignStatus.SENDING) == 0) {
      CampaignStatus current = campaignStore.get(conn, campaignId)
          .map(Campaign::status)
          .orElseThrow(() -> new NotFoundException("Campaign", campaignId));
      throw new InvalidStateTransitionException(campaignId, current, CampaignStatus.SENDING);
    }
    return campaign;
  }

  private List<DeliveryFailure> sendAll(Notifier notifier, Campaign campaign, List<Recipient> recipients)
      throws InterruptedException {
    if (recipients.isEmpty()) {
      return List.of();
    }
    int lanes = Math.min(sendConcurrency, recipients.size());
    ExecutorService senders = Executors.newFixedThreadPool(lanes,
        new DaemonThreadFactory("campaign-" + campaign.id() + "-send-"));
    ExecutorService calls = Executors.newCachedThreadPool(
        new DaemonThreadFactory("campaign-" + campaign.id() + "-call-"));
    try {
      List<Future<DeliveryFailure>> outcomes = new ArrayList<>(recipients.size());
      for (Recipient recipient : recipients) {
        outcomes.add(senders.submit(() -> sendOne(calls, notifier, campaign, recipient.email())));
      }
      List<DeliveryFailure> failures = new ArrayList<>();
      for (int i = 0; i < outcomes.size(); i++) {
        DeliveryFailure failure;
        try {
          failure = outcomes.get(i).get();
        } catch (ExecutionException e) {
          failure = new DeliveryFailure(recipients.get(i).email(), describe(e.getCause()));
        }
        if (failure != null) {
          failures.add(failure);
        }
      }
      return failures;
    } finally {
      senders.shutdownNow();
      calls.shutdownNow();
    }
  }

  /**
   * Runs one notifier call under the per-call timeout. Returns {@code null} on success.
   */
  private DeliveryFailure sendOne(ExecutorService calls, Notifier notifier, Campaign campaign, String email)
      throws InterruptedException {
    Future<SendResult> call = calls.submit(() -> notifier.send(campaign.title(), campaign.message(), email));
    String reason;
    try {
      SendResult result = call.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (result == null) {
        reason = "Notifier returned no result";
      } else if (result.isSuccess()) {
        metrics.incrementSendSuccess();
        return null;
      } else if (result instanceof SendResult.Failed) {
        reason = ((SendResult.Failed) result).reason();
      } else {
        reason = "Notifier reported " + result;
      }
    } catch (TimeoutException e) {
      call.cancel(true);
      reason = "Timed out after " + sendTimeout.toMillis() + " ms";
    } catch (ExecutionException e) {
      reason = describe(e.getCause());
    }
    metrics.incrementSendFailure();
    logger.warning("Delivery failed for campaign " + campaign.id() + " to " + email + ": " + reason);
    return new DeliveryFailure(email, reason);
  }

  private void finish(long campaignId, List<DeliveryFailure> failures, CampaignStatus outcome)
      throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        campaignStore.replaceDeliveryFailures(conn, campaignId, failures);
        campaignStore.setStatus(conn, campaignId, outcome);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    }
  }

  @Override
  public void onExhausted(JobEnvelope job, Exception lastFailure) {
    long campaignId = job.targetId();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int updated = campaignStore.compareAndSetStatus(conn, campaignId,
          EnumSet.of(CampaignStatus.SENDING), CampaignStatus.SEND_FAILED);
      if (updated > 0) {
        logger.log(Level.SEVERE, "Dispatch for campaign " + campaignId
            + " gave up; status set to send_failed (jobId=" + job.jobId() + ")", lastFailure);
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to mark campaign " + campaignId + " send_failed", e);
    }
  }

  private static String describe(Throwable t) {
    if (t == null) {
      return "unknown error";
    }
    String message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
  }

  /** Builder for {@link CampaignDispatchJob}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private CampaignStore campaignStore;
    private RecipientStore recipientStore;
    private NotifierRegistry notifierRegistry;
    private String channel;
    private int sendConcurrency = 10;
    private Duration sendTimeout = Duration.ofSeconds(30);
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     *
     * @param connectionProvider source of the connections used to read and write campaign state
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param campaignStore campaign persistence
     * @return this builder
     */
    public Builder campaignStore(CampaignStore campaignStore) {
      this.campaignStore = campaignStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param recipientStore recipient persistence, used to list eligible recipients
     * @return this builder
     */
    public Builder recipientStore(RecipientStore recipientStore) {
      this.recipientStore = recipientStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param notifierRegistry where the dispatch channel's notifier is looked up
     * @return this builder
     */
    public Builder notifierRegistry(NotifierRegistry notifierRegistry) {
      this.notifierRegistry = notifierRegistry;
      return this;
    }

    /**
     * Sets the channel to send through.
     *
     * <p>Optional. Defaults to {@link NotifierRegistry#defaultChannel()}.
     *
     * @param channel channel name
     * @return this builder
     */
    public Builder channel(String channel) {
      this.channel = channel;
      return this;
    }

    /**
     * Sets the maximum number of notifier calls in flight for one dispatch run.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
     *
     * @param sendConcurrency concurrent sends per dispatch
     * @return this builder
     */
    public Builder sendConcurrency(int sendConcurrency) {
      this.sendConcurrency = sendConcurrency;
      return this;
    }

    /**
     * Sets the time budget for one notifier call.
     *
     * <p>Optional. Defaults to 30 seconds. Must be positive.
     *
     * @param sendTimeout per-call timeout
     * @return this builder
     */
    public Builder sendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics exporter for per-recipient send counters
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @return a new {@link CampaignDispatchJob}
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if {@code sendConcurrency < 1} or {@code sendTimeout}
     *                                  is not positive
     */
    public CampaignDispatchJob build() {
      return new CampaignDispatchJob(this);
    }
  }
}
