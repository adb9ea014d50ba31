package io.campaign.dead;

import io.campaign.model.JobKind;
import io.campaign.model.JobRecord;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.JobStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Facade for querying, counting and replaying DEAD jobs. Manages connections internally.
 *
 * <p>A replayed job goes back to NEW with zero attempts and is picked up by the next poll.
 * Replaying a dispatch job whose campaign was moved to {@code send_failed} dispatches it
 * again; replaying a linking job resumes a campaign left in {@code processing}.
 *
 * @see JobStore#queryDead
 * @see JobStore#replayDead
 */
public final class DeadJobManager {
  private static final Logger logger = Logger.getLogger(DeadJobManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;

  public DeadJobManager(ConnectionProvider connectionProvider, JobStore jobStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
  }

  /**
   * @param kind  optional kind filter ({@code null} for all)
   * @param limit maximum number of jobs to return
   * @return dead jobs, oldest first; empty if the query failed
   */
  public List<JobRecord> query(JobKind kind, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.queryDead(conn, kind, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query dead jobs", e);
      return List.of();
    }
  }

  /**
   * @return {@code true} if the job was DEAD and is now NEW
   */
  public boolean replay(String jobId) {
    try (Connection conn = connectionProvider.getConnection()) {
      boolean replayed = jobStore.replayDead(conn, jobId) > 0;
      if (replayed) {
        logger.info("Replayed dead job " + jobId);
      }
      return replayed;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to replay dead job: " + jobId, e);
      return false;
    }
  }

  /**
   * Replays every DEAD job of the given kind, in batches.
   *
   * @param kind      optional kind filter ({@code null} for all)
   * @param batchSize jobs per batch
   * @return total number of jobs replayed
   */
  public int replayAll(JobKind kind, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    int total = 0;
    List<JobRecord> batch;
    do {
      int replayed = 0;
      try (Connection conn = connectionProvider.getConnection()) {
        batch = jobStore.queryDead(conn, kind, batchSize);
        for (JobRecord job : batch) {
          if (jobStore.replayDead(conn, job.jobId()) > 0) {
            replayed++;
          }
        }
      } catch (SQLException e) {
        logger.log(Level.SEVERE, "Failed to replay dead jobs batch", e);
        break;
      }
      total += replayed;
      if (replayed == 0) {
        break;
      }
    } while (batch.size() >= batchSize);
    return total;
  }

  /**
   * @param kind optional kind filter ({@code null} for all)
   * @return the number of dead jobs; 0 if the count failed
   */
  public int count(JobKind kind) {
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.countDead(conn, kind);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count dead jobs", e);
      return 0;
    }
  }
}
