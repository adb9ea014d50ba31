package io.campaign.jdbc.dialect;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.JobRows;
import io.campaign.model.JobRecord;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * MySQL dialect (also MariaDB). MySQL rejects a subquery on the table being updated, so
 * the claim uses {@code UPDATE ... ORDER BY ... LIMIT} and then reads the claimed rows back.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public List<JobRecord> claimPending(Connection conn, String table, String ownerId,
      Instant now, Instant lockExpiry, Instant recentCutoff, int limit) {
    // DATETIME(3) keeps milliseconds only
    Timestamp lockedAt = Timestamp.from(now.truncatedTo(ChronoUnit.MILLIS));
    String claimSql = "UPDATE " + table + " SET locked_by=?, locked_at=? " +
        "WHERE status IN " + JobRows.PENDING_STATUS_IN + " AND available_at <= ?" +
        " AND (locked_by IS NULL OR locked_at < ?)" +
        " AND created_at <= ? ORDER BY created_at LIMIT ?";
    int updated = JdbcTemplate.update(conn, claimSql,
        ownerId, lockedAt, Timestamp.from(now),
        Timestamp.from(lockExpiry), Timestamp.from(recentCutoff), limit);
    if (updated == 0) {
      return List.of();
    }
    return selectClaimed(conn, table, ownerId, lockedAt);
  }
}
