package io.campaign.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper to reduce boilerplate in the store implementations.
 * Every {@link SQLException} is rethrown as {@link CampaignStoreException}.
 */
public final class JdbcTemplate {
  private static final String UNIQUE_VIOLATION_STATE = "23505";
  private static final int MYSQL_DUPLICATE_KEY = 1062;

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new CampaignStoreException("Failed to execute update", e);
    }
  }

  /**
   * Execute INSERT, return rows affected; a unique-key violation returns 0 instead of
   * failing. Not for PostgreSQL inside a transaction, where the failed statement aborts it.
   */
  public static int insertIgnoringDuplicate(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      if (isUniqueViolation(e)) {
        return 0;
      }
      throw new CampaignStoreException("Failed to execute insert", e);
    }
  }

  /** Execute INSERT into a table whose first column is a generated id, return the id. */
  public static long insertReturningKey(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
      bindParams(ps, params);
      ps.executeUpdate();
      try (ResultSet keys = ps.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new CampaignStoreException("Insert returned no generated key");
        }
        return keys.getLong(1);
      }
    } catch (SQLException e) {
      throw new CampaignStoreException("Failed to execute insert", e);
    }
  }

  /** Execute the same statement once per parameter row in one JDBC batch. */
  public static int[] batchUpdate(Connection conn, String sql, List<Object[]> rows) {
    if (rows.isEmpty()) {
      return new int[0];
    }
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (Object[] row : rows) {
        bindParams(ps, row);
        ps.addBatch();
      }
      return ps.executeBatch();
    } catch (SQLException e) {
      throw new CampaignStoreException("Failed to execute batch", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new CampaignStoreException("Failed to execute query", e);
    }
  }

  /** Execute SELECT expected to match at most one row. */
  public static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Execute UPDATE ... RETURNING, map returned rows (PostgreSQL). */
  public static <T> List<T> updateReturning(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new CampaignStoreException("Failed to execute updateReturning", e);
    }
  }

  /**
   * Whether the exception reports a duplicate primary or unique key (SQLState 23505 on
   * H2 and PostgreSQL, error 1062 on MySQL).
   */
  public static boolean isUniqueViolation(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (UNIQUE_VIOLATION_STATE.equals(current.getSQLState())
          || current.getErrorCode() == MYSQL_DUPLICATE_KEY) {
        return true;
      }
    }
    return false;
  }

  /** Comma-separated {@code ?} list for an IN clause or VALUES row. */
  public static String placeholders(int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("count must be > 0");
    }
    return String.join(",", Collections.nCopies(count, "?"));
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Boolean b) {
        ps.setBoolean(i + 1, b);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
