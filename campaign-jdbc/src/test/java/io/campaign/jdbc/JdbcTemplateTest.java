package io.campaign.jdbc;

import io.campaign.TransientStoreException;
import io.campaign.jdbc.support.TestDatabases;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTemplateTest {

  @Test
  void placeholders() {
    assertEquals("?", JdbcTemplate.placeholders(1));
    assertEquals("?,?,?", JdbcTemplate.placeholders(3));
    assertThrows(IllegalArgumentException.class, () -> JdbcTemplate.placeholders(0));
  }

  @Test
  void uniqueViolationDetection() {
    assertTrue(JdbcTemplate.isUniqueViolation(new SQLException("dup", "23505")));
    assertTrue(JdbcTemplate.isUniqueViolation(new SQLException("dup", "23000", 1062)));
    assertFalse(JdbcTemplate.isUniqueViolation(new SQLException("fk", "23503")));
    assertFalse(JdbcTemplate.isUniqueViolation(new SQLException("other")));

    SQLException chained = new SQLException("batch failed", "XX000");
    chained.setNextException(new SQLException("dup", "23505"));
    assertTrue(JdbcTemplate.isUniqueViolation(chained));
  }

  @Test
  void sqlErrorsBecomeTransientStoreExceptions() throws SQLException {
    JdbcDataSource ds = TestDatabases.h2("template");
    try (Connection conn = ds.getConnection()) {
      CampaignStoreException ex = assertThrows(CampaignStoreException.class,
          () -> JdbcTemplate.update(conn, "UPDATE no_such_table SET x=1"));
      assertInstanceOf(TransientStoreException.class, ex);
      assertInstanceOf(SQLException.class, ex.getCause());
    }
  }

  @Test
  void insertReturningKeyAndBatchAndQuery() throws SQLException {
    JdbcDataSource ds = TestDatabases.h2("template");
    Timestamp now = Timestamp.from(Instant.now());
    try (Connection conn = ds.getConnection()) {
      long id = JdbcTemplate.insertReturningKey(conn,
          "INSERT INTO campaign (title, message, status, created_at, updated_at) VALUES (?,?,?,?,?)",
          "t", "m", "pending", now, now);
      assertTrue(id > 0);

      int[] counts = JdbcTemplate.batchUpdate(conn,
          "INSERT INTO campaign_delivery_failure (campaign_id, email, reason, created_at) VALUES (?,?,?,?)",
          List.of(new Object[] {id, "a@x.io", "r1", now}, new Object[] {id, "b@x.io", null, now}));
      assertEquals(2, counts.length);
      assertEquals(0, JdbcTemplate.batchUpdate(conn, "DELETE FROM campaign", List.of()).length);

      List<String> emails = JdbcTemplate.query(conn,
          "SELECT email FROM campaign_delivery_failure WHERE campaign_id=? ORDER BY id", rs -> rs.getString(1), id);
      assertEquals(List.of("a@x.io", "b@x.io"), emails);
      assertTrue(JdbcTemplate.queryOne(conn, "SELECT title FROM campaign WHERE id=?", rs -> rs.getString(1), -1L)
          .isEmpty());
    }
  }
}
