package io.campaign;

import io.campaign.model.Campaign;
import io.campaign.model.JobKind;
import io.campaign.model.RecipientTarget;
import io.campaign.model.SubmittedCampaign;
import io.campaign.spi.CampaignStore;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.GroupStore;
import io.campaign.spi.JobStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for enqueueing work. Every call returns as soon as the job row is committed;
 * the job itself runs later on a dispatcher worker.
 *
 * <p>Each submit runs in its own short transaction. After commit the configured
 * {@link SubmitHook} is invoked to hand the job to the hot path. If the hot queue is full,
 * the job waits for the poller. A storage failure during submit surfaces as
 * {@link TransientStoreException} and nothing is enqueued.
 *
 * @see SubmitHook
 * @see io.campaign.spi.JobStore
 */
public final class JobSubmitter {
    private static final Logger logger = Logger.getLogger(JobSubmitter.class.getName());

    private final ConnectionProvider connectionProvider;
    private final JobStore jobStore;
    private final CampaignStore campaignStore;
    private final GroupStore groupStore;
    private final SubmitHook submitHook;

    public JobSubmitter(ConnectionProvider connectionProvider, JobStore jobStore,
            CampaignStore campaignStore, GroupStore groupStore) {
        this(connectionProvider, jobStore, campaignStore, groupStore, SubmitHook.NOOP);
    }

    /**
     * @param submitHook invoked after each commit; {@code null} defaults to {@link SubmitHook#NOOP}
     */
    public JobSubmitter(ConnectionProvider connectionProvider, JobStore jobStore,
            CampaignStore campaignStore, GroupStore groupStore, SubmitHook submitHook) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.campaignStore = Objects.requireNonNull(campaignStore, "campaignStore");
        this.groupStore = Objects.requireNonNull(groupStore, "groupStore");
        this.submitHook = submitHook == null ? SubmitHook.NOOP : submitHook;
    }

    /**
     * Creates a {@code pending} campaign and queues the linking job for its addresses in the
     * same transaction.
     *
     * @param title     campaign title
     * @param message   campaign body
     * @param rawEmails addresses as submitted; normalized when the job runs
     * @return the campaign and the linking job id
     */
    public SubmittedCampaign createCampaign(String title, String message, List<String> rawEmails) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(rawEmails, "rawEmails");
        if (title.isBlank()) {
            throw new IllegalArgumentException("title cannot be blank");
        }
        CreatedCampaign created = inTransaction(conn -> {
            Campaign campaign = campaignStore.create(conn, title, message);
            JobEnvelope job = JobEnvelope.linking(campaign.id(), rawEmails);
            jobStore.insertNew(conn, job);
            return new CreatedCampaign(campaign, job);
        });
        logger.info("Created campaign " + created.campaign().id() + " with linking job " + created.job().jobId());
        afterCommit(created.job());
        return new SubmittedCampaign(created.campaign(), created.job().jobId());
    }

    /**
     * Queues linking of raw email strings to an existing campaign.
     *
     * @return the job id
     */
    public String submitLinkingJob(long campaignId, List<String> rawEmails) {
        Objects.requireNonNull(rawEmails, "rawEmails");
        return submit(conn -> JobEnvelope.linking(campaignId, rawEmails)).jobId();
    }

    /**
     * Queues linking of addresses that carry display names.
     *
     * @return the job id
     */
    public String submitLinkingTargets(long campaignId, List<RecipientTarget> targets) {
        Objects.requireNonNull(targets, "targets");
        return submit(conn -> JobEnvelope.builder(JobKind.LINK_RECIPIENTS)
                .targetId(campaignId)
                .targets(targets)
                .build()).jobId();
    }

    /**
     * Queues a dispatch of the campaign. The campaign's status is checked when the job runs.
     *
     * @return the job id
     * @throws NotFoundException if the campaign does not exist
     */
    public String submitDispatchJob(long campaignId) {
        return submit(conn -> {
            if (campaignStore.get(conn, campaignId).isEmpty()) {
                throw new NotFoundException("Campaign", campaignId);
            }
            return JobEnvelope.dispatch(campaignId);
        }).jobId();
    }

    /**
     * Queues the upsert of raw addresses and their assignment to a group.
     *
     * @return the job id
     * @throws NotFoundException if the group does not exist
     */
    public String submitGroupAssignmentJob(long groupId, List<String> rawEmails) {
        Objects.requireNonNull(rawEmails, "rawEmails");
        return submit(conn -> {
            if (groupStore.findById(conn, groupId).isEmpty()) {
                throw new NotFoundException("Group", groupId);
            }
            return JobEnvelope.groupAssignment(groupId, rawEmails);
        }).jobId();
    }

    private JobEnvelope submit(JobFactory factory) {
        JobEnvelope job = inTransaction(conn -> {
            JobEnvelope created = factory.create(conn);
            jobStore.insertNew(conn, created);
            return created;
        });
        logger.fine("Submitted " + job);
        afterCommit(job);
        return job;
    }

    private <T> T inTransaction(SqlWork<T> work) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to submit job", e);
        }
    }

    private void afterCommit(JobEnvelope job) {
        try {
            submitHook.afterCommit(job);
        } catch (RuntimeException ex) {
            logger.log(Level.WARNING, "SubmitHook.afterCommit failed for jobId=" + job.jobId(), ex);
        }
    }

    @FunctionalInterface
    private interface JobFactory {
        JobEnvelope create(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    private record CreatedCampaign(Campaign campaign, JobEnvelope job) {}
}
