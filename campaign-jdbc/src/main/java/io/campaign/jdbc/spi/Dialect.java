package io.campaign.jdbc.spi;

import io.campaign.model.JobRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific SQL for job rows plus the two statements
 * whose shape differs most across vendors: the batch claim and the duplicate-tolerant insert.
 * Register custom dialects via {@code META-INF/services/io.campaign.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL, PostgreSQL, H2.
 *
 * @see io.campaign.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * SQL for inserting a new job row with status NEW.
   *
   * <p>Parameters (in order):
   * <ol>
   *   <li>job_id (String)</li>
   *   <li>kind (String)</li>
   *   <li>target_id (long)</li>
   *   <li>payload (String/JSON, nullable)</li>
   *   <li>available_at (Timestamp)</li>
   *   <li>created_at (Timestamp)</li>
   * </ol>
   */
  String insertJobSql(String table);

  /**
   * SQL for claiming a single job for a worker run. Increments {@code deliveries}.
   *
   * <p>Parameters: locked_by (String), locked_at (Timestamp), job_id (String),
   * owner (String), lock expiry (Timestamp)
   */
  String claimJobSql(String table);

  /**
   * SQL for marking a job as DONE.
   *
   * <p>Parameters: done_at (Timestamp), job_id (String)
   */
  String markDoneSql(String table);

  /**
   * SQL for marking a job for RETRY after a failed attempt.
   *
   * <p>Parameters: available_at (Timestamp), last_error (String), job_id (String)
   */
  String markRetrySql(String table);

  /**
   * SQL for pushing a job back without counting an attempt.
   *
   * <p>Parameters: available_at (Timestamp), job_id (String)
   */
  String markDeferredSql(String table);

  /**
   * SQL for marking a job as DEAD.
   *
   * <p>Parameters: last_error (String), job_id (String)
   */
  String markDeadSql(String table);

  /**
   * Claim and return pending jobs atomically, oldest first.
   *
   * <p>Sets {@code locked_by} and {@code locked_at} on claimed rows. Does not touch
   * {@code deliveries}; that is counted when a worker claims the job itself.
   *
   * @param conn         JDBC connection
   * @param table        job table name
   * @param ownerId      node identifier
   * @param now          current time
   * @param lockExpiry   locks older than this are considered expired
   * @param recentCutoff jobs created after this are skipped
   * @param limit        max rows to claim
   * @return claimed jobs
   */
  List<JobRecord> claimPending(Connection conn, String table, String ownerId,
      Instant now, Instant lockExpiry, Instant recentCutoff, int limit);

  /**
   * Inserts one row unless a row with the same unique key already exists.
   *
   * <p>Safe to call concurrently for the same key from several connections: exactly one
   * caller sees {@code 1}.
   *
   * @param conn       JDBC connection
   * @param table      target table
   * @param columns    columns to insert
   * @param keyColumns columns of the unique key that may conflict
   * @param values     one value per column, in order
   * @return 1 if inserted, 0 if the row already existed
   */
  int insertIfAbsent(Connection conn, String table, List<String> columns, List<String> keyColumns,
      Object... values);
}
