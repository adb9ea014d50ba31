package io.campaign.spi;

import io.campaign.JobEnvelope;
import io.campaign.model.JobKind;
import io.campaign.model.JobRecord;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for queued jobs, managing status transitions through the
 * lifecycle: NEW &rarr; DONE, NEW &rarr; RETRY &rarr; DONE, or NEW &rarr; DEAD.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries.
 */
public interface JobStore {

  /**
   * Inserts a new job with status NEW, zero attempts and no lock.
   */
  void insertNew(Connection conn, JobEnvelope job);

  Optional<JobRecord> find(Connection conn, String jobId);

  /**
   * Locks a single pending job for execution by {@code ownerId} and increments its
   * delivery counter.
   *
   * <p>The claim succeeds if the job is NEW or RETRY and is unlocked, already locked by
   * {@code ownerId}, or locked before {@code lockExpiry}.
   *
   * @return the claimed row with the updated delivery count, or empty if the job is
   *     finished, dead, or held by another owner
   */
  Optional<JobRecord> claim(Connection conn, String jobId, String ownerId, Instant now, Instant lockExpiry);

  /**
   * Claims a batch of pending jobs whose {@code available_at} has passed, oldest first.
   * Claimed rows carry {@code ownerId} so other poller instances skip them until
   * {@code lockExpiry}.
   */
  List<JobRecord> claimPending(Connection conn, String ownerId, Instant now, Instant lockExpiry,
      Duration skipRecent, int limit);

  int markDone(Connection conn, String jobId);

  /**
   * Schedules another attempt at {@code nextAt}, increments {@code attempts} and
   * releases the lock.
   */
  int markRetry(Connection conn, String jobId, Instant nextAt, String error);

  /**
   * Postpones the job to {@code nextAt} and releases the lock without counting an attempt.
   * Used when another job for the same target is still running.
   */
  int markDeferred(Connection conn, String jobId, Instant nextAt);

  int markDead(Connection conn, String jobId, String error);

  /**
   * Queries DEAD jobs, oldest first.
   *
   * @param kind optional kind filter ({@code null} for all)
   */
  List<JobRecord> queryDead(Connection conn, JobKind kind, int limit);

  /**
   * Resets a DEAD job to NEW with zero attempts. Returns 0 if the job is not DEAD.
   */
  int replayDead(Connection conn, String jobId);

  int countDead(Connection conn, JobKind kind);
}
