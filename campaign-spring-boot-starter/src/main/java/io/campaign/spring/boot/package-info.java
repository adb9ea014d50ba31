/**
 * Spring Boot auto-configuration for the campaign dispatch pipeline.
 *
 * <p>Adding the starter to an application with a {@link javax.sql.DataSource} yields
 * {@link io.campaign.JobSubmitter}, {@link io.campaign.recipient.RecipientDirectory} and
 * {@link io.campaign.dead.DeadJobManager} beans, configured through {@code campaign.*}
 * properties.
 *
 * @see io.campaign.spring.boot.CampaignAutoConfiguration
 * @see io.campaign.spring.boot.CampaignProperties
 */
package io.campaign.spring.boot;
