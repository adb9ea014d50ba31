/**
 * Service provider interfaces implemented by storage and metrics modules.
 *
 * <p>Every store method takes an explicit {@link java.sql.Connection}; one job run
 * obtains a connection from {@link io.campaign.spi.ConnectionProvider} and hands it
 * to whichever stores it needs.
 *
 * @see io.campaign.spi.RecipientStore
 * @see io.campaign.spi.CampaignStore
 * @see io.campaign.spi.JobStore
 */
package io.campaign.spi;
