package io.campaign.job;

import io.campaign.InvalidStateTransitionException;
import io.campaign.JobEnvelope;
import io.campaign.NotFoundException;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.LinkingReport;
import io.campaign.model.Recipient;
import io.campaign.model.RecipientTarget;
import io.campaign.spi.CampaignStore;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.RecipientStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a campaign's raw address list into deduplicated, persisted recipients linked to it.
 *
 * <p>The campaign moves {@code pending -> processing -> ready}. Each unique address is
 * upserted by normalized email (an existing row, including its opt-out flag, is never
 * touched) and then associated with the campaign if not already. Opted-out recipients are
 * linked too; dispatch filters them out.
 *
 * <p>Running the same input twice reaches the same end state, so redelivery is safe. A
 * campaign that is {@code sending}, {@code sent} or {@code send_failed} rejects further linking.
 */
public final class RecipientLinkingJob implements JobHandler {
  private static final Logger logger = Logger.getLogger(RecipientLinkingJob.class.getName());

  private final ConnectionProvider connectionProvider;
  private final RecipientStore recipientStore;
  private final CampaignStore campaignStore;

  public RecipientLinkingJob(ConnectionProvider connectionProvider, RecipientStore recipientStore,
      CampaignStore campaignStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.recipientStore = Objects.requireNonNull(recipientStore, "recipientStore");
    this.campaignStore = Objects.requireNonNull(campaignStore, "campaignStore");
  }

  @Override
  public void handle(JobExecution execution) throws SQLException {
    JobEnvelope job = execution.job();
    LinkingReport report = link(job.targetId(), job.targets());
    logger.info("Linked campaign " + report.targetId() + ": " + report.unique() + " unique of "
        + report.submitted() + " submitted, " + report.affected() + " new links, "
        + report.rejected().size() + " rejected (jobId=" + job.jobId() + ")");
  }

  /**
   * Links the given raw addresses to the campaign and marks it ready.
   *
   * @param campaignId the campaign to link to
   * @param rawTargets address entries as submitted
   * @return counts for the run
   * @throws NotFoundException               if the campaign does not exist
   * @throws InvalidStateTransitionException if the campaign is being sent or already sent or failed
   * @throws SQLException                    if a connection cannot be obtained
   */
  public LinkingReport link(long campaignId, List<RecipientTarget> rawTargets) throws SQLException {
    EmailAddresses.Canonical canonical = EmailAddresses.canonicalize(rawTargets);
    for (String rejected : canonical.rejected()) {
      logger.warning("Skipping malformed address for campaign " + campaignId + ": '" + rejected + "'");
    }

    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      startProcessing(conn, campaignId);

      int linked = 0;
      for (RecipientTarget target : canonical.targets()) {
        Recipient recipient = recipientStore.upsert(conn, target.email(), target.name());
        if (recipientStore.linkToCampaign(conn, campaignId, recipient.id())) {
          linked++;
        }
        if (recipient.optOut()) {
          logger.fine("Linked opted-out recipient " + recipient.email() + " to campaign " + campaignId);
        }
      }

      int updated = campaignStore.compareAndSetStatus(conn, campaignId,
          EnumSet.of(CampaignStatus.PROCESSING), CampaignStatus.READY);
      if (updated == 0) {
        logger.warning("Campaign " + campaignId + " left processing while linking; status not set to ready");
      }
      return new LinkingReport(campaignId, rawTargets.size(), canonical.targets().size(), linked,
          canonical.rejected());
    }
  }

  private void startProcessing(Connection conn, long campaignId) {
    Campaign campaign = campaignStore.get(conn, campaignId)
        .orElseThrow(() -> new NotFoundException("Campaign", campaignId));
    if (!campaign.status().isLinkable()) {
      throw new InvalidStateTransitionException(campaignId, campaign.status(), CampaignStatus.PROCESSING);
    }
    int updated = campaignStore.compareAndSetStatus(conn, campaignId,
        CampaignStatus.linkable(), CampaignStatus.PROCESSING);
    if (updated == 0) {
      CampaignStatus current = campaignStore.get(conn, campaignId)
          .map(Campaign::status)
          .orElseThrow(() -> new NotFoundException("Campaign", campaignId));
      throw new InvalidStateTransitionException(campaignId, current, CampaignStatus.PROCESSING);
    }
  }

  @Override
  public void onExhausted(JobEnvelope job, Exception lastFailure) {
    logger.log(Level.SEVERE, "Linking for campaign " + job.targetId()
        + " gave up; campaign stays in processing until the job is replayed (jobId=" + job.jobId() + ")",
        lastFailure);
  }
}
