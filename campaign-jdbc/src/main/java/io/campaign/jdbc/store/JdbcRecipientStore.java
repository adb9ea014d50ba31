package io.campaign.jdbc.store;

import io.campaign.NotFoundException;
import io.campaign.jdbc.CampaignStoreException;
import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.spi.Dialect;
import io.campaign.model.Recipient;
import io.campaign.spi.RecipientStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.campaign.jdbc.TableNames.CAMPAIGN_RECIPIENT;
import static io.campaign.jdbc.TableNames.RECIPIENT;

/**
 * JDBC recipient store over the {@code recipient} and {@code campaign_recipient} tables.
 *
 * <p>Creation and linking go through {@link Dialect#insertIfAbsent}, so concurrent jobs
 * submitting the same address end up with one row.
 */
public final class JdbcRecipientStore implements RecipientStore {
  private static final String COLUMNS =
      "id, email, name, opt_out, opt_out_reason, group_id, created_at, updated_at";
  private static final String QUALIFIED_COLUMNS =
      "r.id, r.email, r.name, r.opt_out, r.opt_out_reason, r.group_id, r.created_at, r.updated_at";
  private static final int IN_CHUNK = 500;

  private static final JdbcTemplate.RowMapper<Recipient> ROW_MAPPER = rs -> {
    long groupId = rs.getLong("group_id");
    Long group = rs.wasNull() ? null : groupId;
    return new Recipient(
        rs.getLong("id"),
        rs.getString("email"),
        rs.getString("name"),
        rs.getBoolean("opt_out"),
        rs.getString("opt_out_reason"),
        group,
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  };

  private final Dialect dialect;

  public JdbcRecipientStore(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public Optional<Recipient> findByEmail(Connection conn, String email) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM " + RECIPIENT + " WHERE email=?",
        ROW_MAPPER, email);
  }

  @Override
  public Optional<Recipient> findById(Connection conn, long recipientId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM " + RECIPIENT + " WHERE id=?",
        ROW_MAPPER, recipientId);
  }

  @Override
  public Recipient upsert(Connection conn, String email, String name) {
    Optional<Recipient> existing = findByEmail(conn, email);
    if (existing.isPresent()) {
      return existing.get();
    }
    Timestamp now = now();
    dialect.insertIfAbsent(conn, RECIPIENT,
        List.of("email", "name", "opt_out", "created_at", "updated_at"), List.of("email"),
        email, name, Boolean.FALSE, now, now);
    return findByEmail(conn, email)
        .orElseThrow(() -> new CampaignStoreException("Recipient row missing after insert: " + email));
  }

  @Override
  public Recipient setOptOut(Connection conn, String email, boolean optOut, String reason) {
    String sql = "UPDATE " + RECIPIENT + " SET opt_out=?, opt_out_reason=?, updated_at=? WHERE email=?";
    int updated = JdbcTemplate.update(conn, sql, optOut, optOut ? reason : null, now(), email);
    if (updated == 0) {
      throw new NotFoundException("Recipient", email);
    }
    return findByEmail(conn, email).orElseThrow(() -> new NotFoundException("Recipient", email));
  }

  @Override
  public Recipient updateName(Connection conn, String email, String name) {
    String sql = "UPDATE " + RECIPIENT + " SET name=?, updated_at=? WHERE email=?";
    if (JdbcTemplate.update(conn, sql, name, now(), email) == 0) {
      throw new NotFoundException("Recipient", email);
    }
    return findByEmail(conn, email).orElseThrow(() -> new NotFoundException("Recipient", email));
  }

  @Override
  public boolean linkToCampaign(Connection conn, long campaignId, long recipientId) {
    return dialect.insertIfAbsent(conn, CAMPAIGN_RECIPIENT,
        List.of("campaign_id", "recipient_id", "created_at"), List.of("campaign_id", "recipient_id"),
        campaignId, recipientId, now()) > 0;
  }

  @Override
  public List<Recipient> listEligible(Connection conn, long campaignId) {
    String sql = "SELECT " + QUALIFIED_COLUMNS + " FROM " + RECIPIENT + " r" +
        " JOIN " + CAMPAIGN_RECIPIENT + " cr ON cr.recipient_id = r.id" +
        " WHERE cr.campaign_id=? AND r.opt_out=? ORDER BY r.id";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, campaignId, Boolean.FALSE);
  }

  @Override
  public List<Recipient> listByCampaign(Connection conn, long campaignId) {
    String sql = "SELECT " + QUALIFIED_COLUMNS + " FROM " + RECIPIENT + " r" +
        " JOIN " + CAMPAIGN_RECIPIENT + " cr ON cr.recipient_id = r.id" +
        " WHERE cr.campaign_id=? ORDER BY r.id";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, campaignId);
  }

  @Override
  public List<Recipient> listByGroup(Connection conn, long groupId, boolean activeOnly) {
    if (activeOnly) {
      String sql = "SELECT " + COLUMNS + " FROM " + RECIPIENT + " WHERE group_id=? AND opt_out=? ORDER BY id";
      return JdbcTemplate.query(conn, sql, ROW_MAPPER, groupId, Boolean.FALSE);
    }
    String sql = "SELECT " + COLUMNS + " FROM " + RECIPIENT + " WHERE group_id=? ORDER BY id";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, groupId);
  }

  @Override
  public List<Recipient> listAll(Connection conn, boolean includeOptedOut) {
    if (includeOptedOut) {
      return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM " + RECIPIENT + " ORDER BY id", ROW_MAPPER);
    }
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM " + RECIPIENT + " WHERE opt_out=? ORDER BY id",
        ROW_MAPPER, Boolean.FALSE);
  }

  @Override
  public int assignToGroup(Connection conn, long groupId, List<Long> recipientIds) {
    int updated = 0;
    Timestamp now = now();
    for (int from = 0; from < recipientIds.size(); from += IN_CHUNK) {
      List<Long> chunk = recipientIds.subList(from, Math.min(from + IN_CHUNK, recipientIds.size()));
      String sql = "UPDATE " + RECIPIENT + " SET group_id=?, updated_at=? WHERE id IN (" +
          JdbcTemplate.placeholders(chunk.size()) + ")";
      List<Object> params = new ArrayList<>(chunk.size() + 2);
      params.add(groupId);
      params.add(now);
      params.addAll(chunk);
      updated += JdbcTemplate.update(conn, sql, params.toArray());
    }
    return updated;
  }

  private static Timestamp now() {
    return Timestamp.from(Instant.now().truncatedTo(ChronoUnit.MILLIS));
  }
}
