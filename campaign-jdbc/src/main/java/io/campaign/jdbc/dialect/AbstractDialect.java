package io.campaign.jdbc.dialect;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.JobRows;
import io.campaign.jdbc.spi.Dialect;
import io.campaign.model.JobRecord;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String insertJobSql(String table) {
    return "INSERT INTO " + table + " (" +
        "job_id, kind, target_id, payload, status, attempts, deliveries, available_at, created_at, " +
        "done_at, last_error, locked_by, locked_at" +
        ") VALUES (?,?,?,?,0,0,0,?,?,NULL,NULL,NULL,NULL)";
  }

  @Override
  public String claimJobSql(String table) {
    return "UPDATE " + table +
        " SET locked_by=?, locked_at=?, deliveries=deliveries+1" +
        " WHERE job_id=? AND status IN " + JobRows.PENDING_STATUS_IN +
        " AND (locked_by IS NULL OR locked_by=? OR locked_at < ?)";
  }

  @Override
  public String markDoneSql(String table) {
    return "UPDATE " + table +
        " SET status=1, done_at=?, locked_by=NULL, locked_at=NULL" +
        " WHERE job_id=? AND status<>1";
  }

  @Override
  public String markRetrySql(String table) {
    return "UPDATE " + table +
        " SET status=2, attempts=attempts+1, available_at=?, last_error=?, locked_by=NULL, locked_at=NULL" +
        " WHERE job_id=? AND status IN " + JobRows.PENDING_STATUS_IN;
  }

  @Override
  public String markDeferredSql(String table) {
    return "UPDATE " + table +
        " SET status=2, available_at=?, locked_by=NULL, locked_at=NULL" +
        " WHERE job_id=? AND status IN " + JobRows.PENDING_STATUS_IN;
  }

  @Override
  public String markDeadSql(String table) {
    return "UPDATE " + table +
        " SET status=3, last_error=?, locked_by=NULL, locked_at=NULL" +
        " WHERE job_id=? AND status<>1";
  }

  @Override
  public List<JobRecord> claimPending(Connection conn, String table, String ownerId,
      Instant now, Instant lockExpiry, Instant recentCutoff, int limit) {
    // locked_at is re-read by equality, so keep it at a precision every column type stores
    Timestamp lockedAt = Timestamp.from(now.truncatedTo(ChronoUnit.MILLIS));
    String claimSql = "UPDATE " + table + " SET locked_by=?, locked_at=? " +
        "WHERE job_id IN (" +
        "SELECT job_id FROM " + table +
        " WHERE status IN " + JobRows.PENDING_STATUS_IN + " AND available_at <= ?" +
        " AND (locked_by IS NULL OR locked_at < ?)" +
        " AND created_at <= ? ORDER BY created_at LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql,
        ownerId, lockedAt, Timestamp.from(now),
        Timestamp.from(lockExpiry), Timestamp.from(recentCutoff), limit);
    if (updated == 0) {
      return List.of();
    }
    return selectClaimed(conn, table, ownerId, lockedAt);
  }

  /**
   * Plain INSERT; a unique-key violation is reported as "already present".
   */
  @Override
  public int insertIfAbsent(Connection conn, String table, List<String> columns, List<String> keyColumns,
      Object... values) {
    checkArity(columns, values);
    String sql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" +
        JdbcTemplate.placeholders(columns.size()) + ")";
    return JdbcTemplate.insertIgnoringDuplicate(conn, sql, values);
  }

  protected List<JobRecord> selectClaimed(Connection conn, String table, String ownerId, Timestamp lockedAt) {
    String selectSql = "SELECT " + JobRows.COLUMNS + " FROM " + table +
        " WHERE locked_by=? AND locked_at=? ORDER BY created_at";
    return JdbcTemplate.query(conn, selectSql, JobRows.MAPPER, ownerId, lockedAt);
  }

  protected static void checkArity(List<String> columns, Object[] values) {
    if (columns.isEmpty() || columns.size() != values.length) {
      throw new IllegalArgumentException("Expected " + columns.size() + " values, got " + values.length);
    }
  }
}
