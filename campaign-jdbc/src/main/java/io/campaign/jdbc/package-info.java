/**
 * JDBC persistence for campaign-core: connection helpers, the {@link io.campaign.jdbc.JdbcStores}
 * factory and shared SQL utilities.
 *
 * <p>Every JDBC error surfaces as {@link io.campaign.jdbc.CampaignStoreException}, which the
 * dispatcher treats as retryable.
 *
 * @see io.campaign.jdbc.store
 * @see io.campaign.jdbc.dialect.Dialects
 */
package io.campaign.jdbc;
