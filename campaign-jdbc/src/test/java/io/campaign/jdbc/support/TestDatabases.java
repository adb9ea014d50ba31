package io.campaign.jdbc.support;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Schema loading for tests. Scripts are the ones shipped under {@code /schema}.
 */
public final class TestDatabases {

  private TestDatabases() {}

  /** Fresh in-memory H2 database in PostgreSQL mode with the full schema applied. */
  public static JdbcDataSource h2(String prefix) {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + prefix + "_" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
    applySchema(ds, "/schema/h2.sql");
    return ds;
  }

  public static void applySchema(DataSource dataSource, String resource) {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : loadResource(resource).split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    } catch (SQLException | IOException e) {
      throw new IllegalStateException("Failed to apply " + resource, e);
    }
  }

  /** Empties every table, children first. */
  public static void clear(DataSource dataSource, String jobTable) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("DELETE FROM " + jobTable);
      stmt.execute("DELETE FROM campaign_delivery_failure");
      stmt.execute("DELETE FROM campaign_recipient");
      stmt.execute("DELETE FROM campaign");
      stmt.execute("DELETE FROM recipient");
      stmt.execute("DELETE FROM recipient_group");
    }
  }

  private static String loadResource(String path) throws IOException {
    try (InputStream is = TestDatabases.class.getResourceAsStream(path)) {
      if (is == null) throw new IOException("Resource not found: " + path);
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
