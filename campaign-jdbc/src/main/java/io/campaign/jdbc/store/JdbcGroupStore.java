package io.campaign.jdbc.store;

import io.campaign.NotFoundException;
import io.campaign.jdbc.CampaignStoreException;
import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.spi.Dialect;
import io.campaign.model.Group;
import io.campaign.spi.GroupStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.campaign.jdbc.TableNames.RECIPIENT_GROUP;

/**
 * JDBC group store over the {@code recipient_group} table. Names are unique.
 */
public final class JdbcGroupStore implements GroupStore {
  private static final String COLUMNS = "id, name, description, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<Group> ROW_MAPPER = rs -> new Group(
      rs.getLong("id"),
      rs.getString("name"),
      rs.getString("description"),
      rs.getTimestamp("created_at").toInstant(),
      rs.getTimestamp("updated_at").toInstant());

  private final Dialect dialect;

  public JdbcGroupStore(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public Optional<Group> findById(Connection conn, long groupId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM " + RECIPIENT_GROUP + " WHERE id=?",
        ROW_MAPPER, groupId);
  }

  @Override
  public Optional<Group> findByName(Connection conn, String name) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM " + RECIPIENT_GROUP + " WHERE name=?",
        ROW_MAPPER, name);
  }

  @Override
  public List<Group> listAll(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM " + RECIPIENT_GROUP + " ORDER BY id", ROW_MAPPER);
  }

  @Override
  public Group getOrCreate(Connection conn, String name, String description) {
    Optional<Group> existing = findByName(conn, name);
    if (existing.isPresent()) {
      return existing.get();
    }
    Timestamp now = Timestamp.from(Instant.now().truncatedTo(ChronoUnit.MILLIS));
    dialect.insertIfAbsent(conn, RECIPIENT_GROUP,
        List.of("name", "description", "created_at", "updated_at"), List.of("name"),
        name, description, now, now);
    return findByName(conn, name)
        .orElseThrow(() -> new CampaignStoreException("Group row missing after insert: " + name));
  }

  @Override
  public Group update(Connection conn, long groupId, String name, String description) {
    String sql = "UPDATE " + RECIPIENT_GROUP + " SET name=?, description=?, updated_at=? WHERE id=?";
    Timestamp now = Timestamp.from(Instant.now().truncatedTo(ChronoUnit.MILLIS));
    if (JdbcTemplate.update(conn, sql, name, description, now, groupId) == 0) {
      throw new NotFoundException("Group", groupId);
    }
    return findById(conn, groupId).orElseThrow(() -> new NotFoundException("Group", groupId));
  }
}
