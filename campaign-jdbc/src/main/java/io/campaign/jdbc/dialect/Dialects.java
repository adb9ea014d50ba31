package io.campaign.jdbc.dialect;

import io.campaign.jdbc.CampaignStoreException;
import io.campaign.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * The dialects found on the classpath, keyed by {@link Dialect#name()}.
 *
 * <p>Built-in dialects are registered in
 * {@code META-INF/services/io.campaign.jdbc.spi.Dialect}; another jar can add one the same
 * way. A later registration with the same name replaces an earlier one.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * Dialect pg = Dialects.get("postgresql");
 * }</pre>
 */
public final class Dialects {

  private static final Map<String, Dialect> BY_NAME = load();

  private Dialects() {
  }

  private static Map<String, Dialect> load() {
    Map<String, Dialect> byName = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class)) {
      byName.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
    return Collections.unmodifiableMap(byName);
  }

  public static List<Dialect> all() {
    return List.copyOf(BY_NAME.values());
  }

  /**
   * @param name dialect name, any case
   * @throws IllegalArgumentException if no dialect has this name
   */
  public static Dialect get(String name) {
    Dialect dialect = name == null ? null : BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Returns the dialect whose URL prefix matches, ignoring case.
   */
  public static Optional<Dialect> find(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    return BY_NAME.values().stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(url::startsWith))
        .findFirst();
  }

  /**
   * @throws IllegalArgumentException if the URL is empty or no dialect serves it
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No dialect found for JDBC URL: " + jdbcUrl + ". Supported prefixes: " + prefixes()));
  }

  /**
   * Reads the URL from the connection metadata of {@code dataSource}.
   *
   * @throws CampaignStoreException   if no connection can be opened
   * @throws IllegalArgumentException if no dialect serves the URL
   */
  public static Dialect detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new CampaignStoreException("Failed to read JDBC URL for dialect detection", e);
    }
    return detect(url);
  }

  private static List<String> prefixes() {
    return BY_NAME.values().stream()
        .flatMap(d -> d.jdbcUrlPrefixes().stream())
        .toList();
  }
}
