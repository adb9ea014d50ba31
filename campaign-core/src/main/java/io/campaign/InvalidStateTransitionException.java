package io.campaign;

import io.campaign.model.CampaignStatus;

/**
 * Thrown when a job finds its campaign in a status that does not allow the requested
 * transition. The campaign status is left untouched.
 */
public final class InvalidStateTransitionException extends CampaignException {
  private final long campaignId;
  private final CampaignStatus current;
  private final CampaignStatus attempted;

  public InvalidStateTransitionException(long campaignId, CampaignStatus current, CampaignStatus attempted) {
    super("Campaign " + campaignId + " cannot move from " + current.code() + " to " + attempted.code());
    this.campaignId = campaignId;
    this.current = current;
    this.attempted = attempted;
  }

  public long campaignId() {
    return campaignId;
  }

  public CampaignStatus current() {
    return current;
  }

  public CampaignStatus attempted() {
    return attempted;
  }
}
