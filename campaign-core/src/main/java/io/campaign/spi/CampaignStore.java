package io.campaign.spi;

import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.DeliveryFailure;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence contract for campaigns, their status and their per-recipient delivery
 * failures. Campaign-recipient association rows are written through
 * {@link RecipientStore#linkToCampaign}.
 */
public interface CampaignStore {

  /**
   * Inserts a campaign in {@link CampaignStatus#PENDING}.
   */
  Campaign create(Connection conn, String title, String message);

  Optional<Campaign> get(Connection conn, long campaignId);

  /**
   * Every campaign, oldest first.
   */
  List<Campaign> list(Connection conn);

  /**
   * Unconditionally writes the campaign status.
   *
   * @return the number of rows updated (0 if the campaign does not exist)
   */
  int setStatus(Connection conn, long campaignId, CampaignStatus status);

  /**
   * Writes {@code next} only if the current status is one of {@code expected}.
   *
   * @return the number of rows updated (0 if the status did not match)
   */
  int compareAndSetStatus(Connection conn, long campaignId, Set<CampaignStatus> expected, CampaignStatus next);

  /**
   * Replaces the campaign's recorded delivery failures with {@code failures}.
   * An empty list clears them.
   */
  void replaceDeliveryFailures(Connection conn, long campaignId, List<DeliveryFailure> failures);

  List<DeliveryFailure> listDeliveryFailures(Connection conn, long campaignId);

  /**
   * Number of recipients linked to the campaign, including opted-out ones.
   */
  int countRecipients(Connection conn, long campaignId);
}
