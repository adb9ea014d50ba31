/**
 * Job handlers and the address normalization they share.
 *
 * <p>{@link io.campaign.job.RecipientLinkingJob} ingests a campaign's address list,
 * {@link io.campaign.job.CampaignDispatchJob} fans a campaign out to its eligible recipients
 * and {@link io.campaign.job.GroupAssignmentJob} consolidates addresses into a group. All three
 * are safe to run more than once for the same job.
 */
package io.campaign.job;
