package io.campaign.model;

import java.util.List;

/**
 * Outcome of one dispatch run.
 *
 * @param campaignId the dispatched campaign
 * @param eligible   number of non-opted-out linked recipients
 * @param sent       number of successful notifier calls
 * @param failures   recipients whose notifier call failed or timed out
 * @param status     the final status written for the campaign
 */
public record DispatchReport(
    long campaignId,
    int eligible,
    int sent,
    List<DeliveryFailure> failures,
    CampaignStatus status
) {

  public DispatchReport {
    failures = List.copyOf(failures);
  }

  public boolean allDelivered() {
    return failures.isEmpty();
  }
}
