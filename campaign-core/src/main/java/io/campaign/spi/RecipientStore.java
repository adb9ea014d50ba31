package io.campaign.spi;

import io.campaign.model.Recipient;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for recipients, keyed by normalized email.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls transaction
 * boundaries. Emails passed in are expected to be normalized already
 * (see {@link io.campaign.job.EmailAddresses#normalize}).
 */
public interface RecipientStore {

  Optional<Recipient> findByEmail(Connection conn, String email);

  Optional<Recipient> findById(Connection conn, long recipientId);

  /**
   * Creates the recipient if no row exists for {@code email}; otherwise returns the existing
   * row unchanged. Opt-out flag, reason, name and group of an existing row are never
   * overwritten. Safe under concurrent callers racing on the same email.
   *
   * @param conn  the JDBC connection
   * @param email normalized email
   * @param name  display name for a newly created row (may be {@code null})
   * @return the persisted recipient
   */
  Recipient upsert(Connection conn, String email, String name);

  /**
   * Sets or clears the opt-out flag.
   *
   * @param conn   the JDBC connection
   * @param email  normalized email
   * @param optOut new flag value
   * @param reason opt-out reason; cleared when opting back in
   * @return the updated recipient
   * @throws io.campaign.NotFoundException if no recipient exists for {@code email}
   */
  Recipient setOptOut(Connection conn, String email, boolean optOut, String reason);

  /**
   * Updates the display name of an existing recipient.
   *
   * @throws io.campaign.NotFoundException if no recipient exists for {@code email}
   */
  Recipient updateName(Connection conn, String email, String name);

  /**
   * Associates a recipient with a campaign. A no-op if the pair already exists.
   *
   * @return {@code true} if a new association was created
   */
  boolean linkToCampaign(Connection conn, long campaignId, long recipientId);

  /**
   * Recipients linked to the campaign whose opt-out flag is false, ordered by id.
   */
  List<Recipient> listEligible(Connection conn, long campaignId);

  /**
   * All recipients linked to the campaign, including opted-out ones, ordered by id.
   */
  List<Recipient> listByCampaign(Connection conn, long campaignId);

  /**
   * Members of a group, ordered by id.
   *
   * @param activeOnly when {@code true}, opted-out members are excluded
   */
  List<Recipient> listByGroup(Connection conn, long groupId, boolean activeOnly);

  /**
   * Every recipient, ordered by id.
   *
   * @param includeOptedOut when {@code false}, opted-out recipients are excluded
   */
  List<Recipient> listAll(Connection conn, boolean includeOptedOut);

  /**
   * Moves the given recipients into a group in one statement.
   *
   * @return the number of rows updated
   */
  int assignToGroup(Connection conn, long groupId, List<Long> recipientIds);
}
