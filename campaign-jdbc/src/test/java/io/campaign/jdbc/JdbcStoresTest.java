package io.campaign.jdbc;

import io.campaign.jdbc.dialect.PostgresDialect;
import io.campaign.jdbc.store.JdbcJobStore;
import io.campaign.jdbc.support.TestDatabases;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JdbcStoresTest {

  @Test
  void detectPicksDialectFromDataSource() {
    JdbcDataSource ds = TestDatabases.h2("stores");
    JdbcStores stores = JdbcStores.detect(ds);

    assertEquals("h2", stores.dialect().name());
    assertNotNull(stores.recipients());
    assertNotNull(stores.groups());
    assertNotNull(stores.campaigns());
    assertEquals(TableNames.DEFAULT_JOB_TABLE, ((JdbcJobStore) stores.jobs()).tableName());
  }

  @Test
  void createWithCustomJobTable() {
    JdbcStores stores = JdbcStores.create(new PostgresDialect(), "my_jobs", null);
    assertEquals("postgresql", stores.dialect().name());
    assertEquals("my_jobs", ((JdbcJobStore) stores.jobs()).tableName());
  }

  @Test
  void rejectsInvalidJobTable() {
    assertThrows(IllegalArgumentException.class,
        () -> JdbcStores.create(new PostgresDialect(), "bad table", null));
    assertThrows(NullPointerException.class, () -> JdbcStores.create(null));
  }
}
