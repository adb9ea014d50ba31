package io.campaign.model;

/**
 * A freshly created campaign together with the id of the linking job queued for it.
 */
public record SubmittedCampaign(Campaign campaign, String linkingJobId) {}
