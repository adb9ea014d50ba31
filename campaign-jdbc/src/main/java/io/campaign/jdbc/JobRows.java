package io.campaign.jdbc;

import io.campaign.model.JobKind;
import io.campaign.model.JobRecord;
import io.campaign.model.JobStatus;

/**
 * Column list and row mapper shared by the job store and the dialect claim queries.
 */
public final class JobRows {

  public static final String COLUMNS =
      "job_id, kind, target_id, payload, status, attempts, deliveries, created_at, last_error";

  public static final JdbcTemplate.RowMapper<JobRecord> MAPPER = rs -> new JobRecord(
      rs.getString("job_id"),
      JobKind.valueOf(rs.getString("kind")),
      rs.getLong("target_id"),
      rs.getString("payload"),
      JobStatus.fromCode(rs.getInt("status")),
      rs.getInt("attempts"),
      rs.getInt("deliveries"),
      rs.getTimestamp("created_at").toInstant(),
      rs.getString("last_error"));

  /** Pending statuses, as an SQL IN list. */
  public static final String PENDING_STATUS_IN =
      "(" + JobStatus.NEW.code() + "," + JobStatus.RETRY.code() + ")";

  private JobRows() {}
}
