package io.campaign.jdbc.dialect;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.JobRows;
import io.campaign.model.JobRecord;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL dialect. Claims with {@code FOR UPDATE SKIP LOCKED} and {@code RETURNING} in
 * a single round trip, and inserts with {@code ON CONFLICT DO NOTHING}: a failed statement
 * would abort the surrounding transaction.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<JobRecord> claimPending(Connection conn, String table, String ownerId,
      Instant now, Instant lockExpiry, Instant recentCutoff, int limit) {
    String sql = "UPDATE " + table + " SET locked_by=?, locked_at=? " +
        "WHERE job_id IN (" +
        "SELECT job_id FROM " + table +
        " WHERE status IN " + JobRows.PENDING_STATUS_IN + " AND available_at <= ?" +
        " AND (locked_by IS NULL OR locked_at < ?)" +
        " AND created_at <= ? ORDER BY created_at LIMIT ? FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + JobRows.COLUMNS;
    List<JobRecord> claimed = JdbcTemplate.updateReturning(conn, sql, JobRows.MAPPER,
        ownerId, Timestamp.from(now), Timestamp.from(now),
        Timestamp.from(lockExpiry), Timestamp.from(recentCutoff), limit);
    // RETURNING does not follow the subquery order
    List<JobRecord> ordered = new ArrayList<>(claimed);
    ordered.sort(Comparator.comparing(JobRecord::createdAt));
    return ordered;
  }

  @Override
  public int insertIfAbsent(Connection conn, String table, List<String> columns, List<String> keyColumns,
      Object... values) {
    checkArity(columns, values);
    String sql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" +
        JdbcTemplate.placeholders(columns.size()) + ") ON CONFLICT (" + String.join(", ", keyColumns) +
        ") DO NOTHING";
    return JdbcTemplate.update(conn, sql, values);
  }
}
