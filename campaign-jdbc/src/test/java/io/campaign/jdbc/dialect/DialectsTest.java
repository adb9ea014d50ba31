package io.campaign.jdbc.dialect;

import io.campaign.jdbc.spi.Dialect;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DialectsTest {

  @Test
  void allReturnsBuiltInDialects() {
    List<Dialect> dialects = Dialects.all();

    assertTrue(dialects.size() >= 3);
    assertTrue(dialects.stream().anyMatch(d -> d.name().equals("mysql")));
    assertTrue(dialects.stream().anyMatch(d -> d.name().equals("postgresql")));
    assertTrue(dialects.stream().anyMatch(d -> d.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertInstanceOf(MySqlDialect.class, Dialects.get("MySQL"));
    assertInstanceOf(PostgresDialect.class, Dialects.get("POSTGRESQL"));
    assertInstanceOf(H2Dialect.class, Dialects.get("h2"));
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Dialects.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown dialect"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("mysql", Dialects.detect("jdbc:mysql://localhost:3306/campaigns").name());
    assertEquals("mysql", Dialects.detect("jdbc:mariadb://localhost:3306/campaigns").name());
    assertEquals("postgresql", Dialects.detect("jdbc:postgresql://localhost:5432/campaigns").name());
    assertEquals("h2", Dialects.detect("jdbc:h2:mem:test").name());
  }

  @Test
  void detectRejectsUnknownOrEmptyUrl() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Dialects.detect("jdbc:oracle:thin:@localhost"));
    assertTrue(ex.getMessage().contains("jdbc:postgresql:"));
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect(""));
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect((String) null));
  }

  @Test
  void detectFromDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:dialect_detect;DB_CLOSE_DELAY=-1");
    assertEquals("h2", Dialects.detect(ds).name());
  }

  @Test
  void postgresInsertUsesOnConflict() {
    PostgresDialect dialect = new PostgresDialect();
    assertTrue(dialect.insertJobSql("campaign_job").startsWith("INSERT INTO campaign_job"));
    assertTrue(dialect.claimJobSql("campaign_job").contains("deliveries=deliveries+1"));
  }

  @Test
  void insertIfAbsentChecksArity() {
    H2Dialect dialect = new H2Dialect();
    assertThrows(IllegalArgumentException.class,
        () -> dialect.insertIfAbsent(null, "recipient", List.of("email", "name"), List.of("email"), "a@x.io"));
  }
}
