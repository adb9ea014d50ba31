package io.campaign.model;

import java.util.List;

/**
 * A campaign together with every recipient linked to it, opted-out ones included.
 */
public record CampaignOverview(Campaign campaign, List<Recipient> recipients) {

  public CampaignOverview {
    recipients = List.copyOf(recipients);
  }

  public List<String> recipientEmails() {
    return recipients.stream().map(Recipient::email).toList();
  }
}
