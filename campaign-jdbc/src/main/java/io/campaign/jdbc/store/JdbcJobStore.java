package io.campaign.jdbc.store;

import io.campaign.JobEnvelope;
import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.JobRows;
import io.campaign.jdbc.TableNames;
import io.campaign.jdbc.spi.Dialect;
import io.campaign.model.JobKind;
import io.campaign.model.JobRecord;
import io.campaign.model.JobStatus;
import io.campaign.spi.JobStore;
import io.campaign.util.TargetCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC job store. SQL comes from the configured {@link Dialect}; the address list is kept
 * as JSON in the {@code payload} column.
 */
public final class JdbcJobStore implements JobStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  private final Dialect dialect;
  private final String tableName;
  private final TargetCodec targetCodec;

  public JdbcJobStore(Dialect dialect) {
    this(dialect, TableNames.DEFAULT_JOB_TABLE, TargetCodec.getDefault());
  }

  public JdbcJobStore(Dialect dialect, String tableName, TargetCodec targetCodec) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tableName = TableNames.validate(tableName);
    this.targetCodec = Objects.requireNonNull(targetCodec, "targetCodec");
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public void insertNew(Connection conn, JobEnvelope job) {
    Timestamp createdAt = Timestamp.from(job.occurredAt());
    JdbcTemplate.update(conn, dialect.insertJobSql(tableName),
        job.jobId(), job.kind().name(), job.targetId(), targetCodec.toJson(job.targets()),
        createdAt, createdAt);
  }

  @Override
  public Optional<JobRecord> find(Connection conn, String jobId) {
    String sql = "SELECT " + JobRows.COLUMNS + " FROM " + tableName + " WHERE job_id=?";
    return JdbcTemplate.queryOne(conn, sql, JobRows.MAPPER, jobId);
  }

  @Override
  public Optional<JobRecord> claim(Connection conn, String jobId, String ownerId, Instant now, Instant lockExpiry) {
    int updated = JdbcTemplate.update(conn, dialect.claimJobSql(tableName),
        ownerId, Timestamp.from(now), jobId, ownerId, Timestamp.from(lockExpiry));
    if (updated == 0) {
      return Optional.empty();
    }
    return find(conn, jobId);
  }

  @Override
  public List<JobRecord> claimPending(Connection conn, String ownerId, Instant now, Instant lockExpiry,
      Duration skipRecent, int limit) {
    Instant recentCutoff = skipRecent == null ? now : now.minus(skipRecent);
    return dialect.claimPending(conn, tableName, ownerId, now, lockExpiry, recentCutoff, limit);
  }

  @Override
  public int markDone(Connection conn, String jobId) {
    return JdbcTemplate.update(conn, dialect.markDoneSql(tableName), Timestamp.from(Instant.now()), jobId);
  }

  @Override
  public int markRetry(Connection conn, String jobId, Instant nextAt, String error) {
    return JdbcTemplate.update(conn, dialect.markRetrySql(tableName),
        Timestamp.from(nextAt), truncateError(error), jobId);
  }

  @Override
  public int markDeferred(Connection conn, String jobId, Instant nextAt) {
    return JdbcTemplate.update(conn, dialect.markDeferredSql(tableName), Timestamp.from(nextAt), jobId);
  }

  @Override
  public int markDead(Connection conn, String jobId, String error) {
    return JdbcTemplate.update(conn, dialect.markDeadSql(tableName), truncateError(error), jobId);
  }

  @Override
  public List<JobRecord> queryDead(Connection conn, JobKind kind, int limit) {
    if (kind == null) {
      String sql = "SELECT " + JobRows.COLUMNS + " FROM " + tableName +
          " WHERE status=" + JobStatus.DEAD.code() + " ORDER BY created_at LIMIT ?";
      return JdbcTemplate.query(conn, sql, JobRows.MAPPER, limit);
    }
    String sql = "SELECT " + JobRows.COLUMNS + " FROM " + tableName +
        " WHERE status=" + JobStatus.DEAD.code() + " AND kind=? ORDER BY created_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, JobRows.MAPPER, kind.name(), limit);
  }

  /**
   * Resets a DEAD job to NEW with zero attempts. {@code deliveries} is kept, so a replayed
   * dispatch counts as a redelivery.
   */
  @Override
  public int replayDead(Connection conn, String jobId) {
    String sql = "UPDATE " + tableName +
        " SET status=" + JobStatus.NEW.code() +
        ", attempts=0, available_at=?, last_error=NULL, locked_by=NULL, locked_at=NULL" +
        " WHERE job_id=? AND status=" + JobStatus.DEAD.code();
    return JdbcTemplate.update(conn, sql, Timestamp.from(Instant.now()), jobId);
  }

  @Override
  public int countDead(Connection conn, JobKind kind) {
    String sql = "SELECT COUNT(*) FROM " + tableName + " WHERE status=" + JobStatus.DEAD.code();
    List<Integer> counts = kind == null
        ? JdbcTemplate.query(conn, sql, rs -> rs.getInt(1))
        : JdbcTemplate.query(conn, sql + " AND kind=?", rs -> rs.getInt(1), kind.name());
    return counts.isEmpty() ? 0 : counts.get(0);
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
