package io.campaign.job;

import io.campaign.JobEnvelope;
import io.campaign.NotFoundException;
import io.campaign.model.LinkingReport;
import io.campaign.model.Recipient;
import io.campaign.model.RecipientTarget;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.GroupStore;
import io.campaign.spi.RecipientStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Upserts a list of addresses and moves the active ones into a group. Opted-out recipients
 * are created or kept but never assigned. A recipient belongs to at most one group, so
 * assignment replaces any previous group.
 */
public final class GroupAssignmentJob implements JobHandler {
  private static final Logger logger = Logger.getLogger(GroupAssignmentJob.class.getName());

  private final ConnectionProvider connectionProvider;
  private final RecipientStore recipientStore;
  private final GroupStore groupStore;

  public GroupAssignmentJob(ConnectionProvider connectionProvider, RecipientStore recipientStore,
      GroupStore groupStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.recipientStore = Objects.requireNonNull(recipientStore, "recipientStore");
    this.groupStore = Objects.requireNonNull(groupStore, "groupStore");
  }

  @Override
  public void handle(JobExecution execution) throws SQLException {
    JobEnvelope job = execution.job();
    LinkingReport report = assign(job.targetId(), job.targets());
    logger.info("Assigned " + report.affected() + " of " + report.unique() + " recipients to group "
        + report.targetId() + " (jobId=" + job.jobId() + ")");
  }

  /**
   * @throws NotFoundException if the group does not exist
   * @throws SQLException      if a connection cannot be obtained
   */
  public LinkingReport assign(long groupId, List<RecipientTarget> rawTargets) throws SQLException {
    EmailAddresses.Canonical canonical = EmailAddresses.canonicalize(rawTargets);
    for (String rejected : canonical.rejected()) {
      logger.warning("Skipping malformed address for group " + groupId + ": '" + rejected + "'");
    }

    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        if (groupStore.findById(conn, groupId).isEmpty()) {
          throw new NotFoundException("Group", groupId);
        }
        List<Long> active = new ArrayList<>();
        for (RecipientTarget target : canonical.targets()) {
          Recipient recipient = recipientStore.upsert(conn, target.email(), target.name());
          if (recipient.optOut()) {
            logger.warning("Skipping opted-out recipient " + recipient.email() + " for group " + groupId);
          } else {
            active.add(recipient.id());
          }
        }
        int assigned = active.isEmpty() ? 0 : recipientStore.assignToGroup(conn, groupId, active);
        conn.commit();
        return new LinkingReport(groupId, rawTargets.size(), canonical.targets().size(), assigned,
            canonical.rejected());
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    }
  }
}
