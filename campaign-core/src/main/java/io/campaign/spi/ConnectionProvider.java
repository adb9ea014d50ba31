package io.campaign.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to job runs, the submitter, the poller and the dispatcher.
 *
 * <p>Each job run obtains one connection and passes it explicitly to the stores.
 * Callers are responsible for closing the returned connection.
 */
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
