package io.campaign.jdbc.store;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.DeliveryFailure;
import io.campaign.spi.CampaignStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static io.campaign.jdbc.TableNames.CAMPAIGN;
import static io.campaign.jdbc.TableNames.CAMPAIGN_DELIVERY_FAILURE;
import static io.campaign.jdbc.TableNames.CAMPAIGN_RECIPIENT;

/**
 * JDBC campaign store over the {@code campaign} and {@code campaign_delivery_failure} tables.
 * Status is stored by its lowercase code.
 */
public final class JdbcCampaignStore implements CampaignStore {
  private static final String COLUMNS = "id, title, message, status, created_at, updated_at";
  private static final int MAX_REASON_LENGTH = 1000;

  private static final JdbcTemplate.RowMapper<Campaign> ROW_MAPPER = rs -> new Campaign(
      rs.getLong("id"),
      rs.getString("title"),
      rs.getString("message"),
      CampaignStatus.fromCode(rs.getString("status")),
      rs.getTimestamp("created_at").toInstant(),
      rs.getTimestamp("updated_at").toInstant());

  @Override
  public Campaign create(Connection conn, String title, String message) {
    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    String sql = "INSERT INTO " + CAMPAIGN + " (title, message, status, created_at, updated_at) VALUES (?,?,?,?,?)";
    long id = JdbcTemplate.insertReturningKey(conn, sql,
        title, message, CampaignStatus.PENDING.code(), Timestamp.from(now), Timestamp.from(now));
    return new Campaign(id, title, message, CampaignStatus.PENDING, now, now);
  }

  @Override
  public Optional<Campaign> get(Connection conn, long campaignId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM " + CAMPAIGN + " WHERE id=?",
        ROW_MAPPER, campaignId);
  }

  @Override
  public List<Campaign> list(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM " + CAMPAIGN + " ORDER BY id", ROW_MAPPER);
  }

  @Override
  public int setStatus(Connection conn, long campaignId, CampaignStatus status) {
    String sql = "UPDATE " + CAMPAIGN + " SET status=?, updated_at=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, status.code(), now(), campaignId);
  }

  @Override
  public int compareAndSetStatus(Connection conn, long campaignId, Set<CampaignStatus> expected,
      CampaignStatus next) {
    if (expected.isEmpty()) {
      return 0;
    }
    String sql = "UPDATE " + CAMPAIGN + " SET status=?, updated_at=? WHERE id=? AND status IN (" +
        JdbcTemplate.placeholders(expected.size()) + ")";
    List<Object> params = new ArrayList<>(expected.size() + 3);
    params.add(next.code());
    params.add(now());
    params.add(campaignId);
    for (CampaignStatus status : expected) {
      params.add(status.code());
    }
    return JdbcTemplate.update(conn, sql, params.toArray());
  }

  @Override
  public void replaceDeliveryFailures(Connection conn, long campaignId, List<DeliveryFailure> failures) {
    JdbcTemplate.update(conn, "DELETE FROM " + CAMPAIGN_DELIVERY_FAILURE + " WHERE campaign_id=?", campaignId);
    if (failures.isEmpty()) {
      return;
    }
    Timestamp now = now();
    List<Object[]> rows = new ArrayList<>(failures.size());
    for (DeliveryFailure failure : failures) {
      rows.add(new Object[] {campaignId, failure.email(), truncate(failure.reason()), now});
    }
    JdbcTemplate.batchUpdate(conn, "INSERT INTO " + CAMPAIGN_DELIVERY_FAILURE +
        " (campaign_id, email, reason, created_at) VALUES (?,?,?,?)", rows);
  }

  @Override
  public List<DeliveryFailure> listDeliveryFailures(Connection conn, long campaignId) {
    String sql = "SELECT email, reason FROM " + CAMPAIGN_DELIVERY_FAILURE + " WHERE campaign_id=? ORDER BY id";
    return JdbcTemplate.query(conn, sql,
        rs -> new DeliveryFailure(rs.getString("email"), rs.getString("reason")), campaignId);
  }

  @Override
  public int countRecipients(Connection conn, long campaignId) {
    String sql = "SELECT COUNT(*) FROM " + CAMPAIGN_RECIPIENT + " WHERE campaign_id=?";
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getInt(1), campaignId).orElse(0);
  }

  private static Timestamp now() {
    return Timestamp.from(Instant.now().truncatedTo(ChronoUnit.MILLIS));
  }

  private static String truncate(String reason) {
    if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
      return reason;
    }
    return reason.substring(0, MAX_REASON_LENGTH - 3) + "...";
  }
}
