/**
 * JDBC implementations of the campaign store SPI.
 *
 * <p>SQL that differs by database lives in the {@link io.campaign.jdbc.spi.Dialect}; the
 * stores here hold only portable statements.
 *
 * @see io.campaign.jdbc.JdbcStores
 */
package io.campaign.jdbc.store;
