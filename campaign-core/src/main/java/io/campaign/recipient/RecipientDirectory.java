package io.campaign.recipient;

import io.campaign.NotFoundException;
import io.campaign.TransientStoreException;
import io.campaign.job.EmailAddresses;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignOverview;
import io.campaign.model.DeliveryFailure;
import io.campaign.model.Group;
import io.campaign.model.Recipient;
import io.campaign.spi.CampaignStore;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.GroupStore;
import io.campaign.spi.RecipientStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Synchronous operations on recipients, groups and campaign results. Manages connections
 * internally; every call runs in autocommit mode.
 *
 * <p>Emails passed in are normalized before lookup. A storage failure surfaces as
 * {@link TransientStoreException}.
 */
public final class RecipientDirectory {
  private static final Logger logger = Logger.getLogger(RecipientDirectory.class.getName());

  private final ConnectionProvider connectionProvider;
  private final RecipientStore recipientStore;
  private final GroupStore groupStore;
  private final CampaignStore campaignStore;

  public RecipientDirectory(ConnectionProvider connectionProvider, RecipientStore recipientStore,
      GroupStore groupStore, CampaignStore campaignStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.recipientStore = Objects.requireNonNull(recipientStore, "recipientStore");
    this.groupStore = Objects.requireNonNull(groupStore, "groupStore");
    this.campaignStore = Objects.requireNonNull(campaignStore, "campaignStore");
  }

  /**
   * Marks a recipient as opted out. Future dispatches skip them; existing campaign links
   * are kept.
   *
   * @param email  address in any case or padding
   * @param reason free-text reason, may be {@code null}
   * @return the updated recipient
   * @throws NotFoundException if no recipient has this address
   */
  public Recipient optOut(String email, String reason) {
    String normalized = requireEmail(email);
    Recipient recipient = withConnection(conn -> recipientStore.setOptOut(conn, normalized, true, reason));
    logger.info("Recipient " + normalized + " opted out" + (reason == null ? "" : ": " + reason));
    return recipient;
  }

  /**
   * Clears a recipient's opt-out flag and reason.
   *
   * @throws NotFoundException if no recipient has this address
   */
  public Recipient optIn(String email) {
    String normalized = requireEmail(email);
    Recipient recipient = withConnection(conn -> recipientStore.setOptOut(conn, normalized, false, null));
    logger.info("Recipient " + normalized + " opted back in");
    return recipient;
  }

  /**
   * @throws NotFoundException if no recipient has this address
   */
  public Recipient updateRecipientName(String email, String name) {
    String normalized = requireEmail(email);
    return withConnection(conn -> recipientStore.updateName(conn, normalized, name));
  }

  /**
   * Returns the recipient with this address, creating it if absent. An existing recipient's
   * name and opt-out flag are left as they are. When {@code groupId} is given the recipient
   * is moved into that group.
   *
   * @param name    display name for a new recipient, may be {@code null}
   * @param groupId group to place the recipient in, or {@code null} to leave it unchanged
   * @throws IllegalArgumentException if the address is not a valid email
   * @throws NotFoundException        if {@code groupId} names no group
   */
  public Recipient createRecipient(String email, String name, Long groupId) {
    String normalized = requireEmail(email);
    if (!EmailAddresses.isValid(normalized)) {
      throw new IllegalArgumentException("invalid email: " + email);
    }
    return withConnection(conn -> {
      if (groupId != null && groupStore.findById(conn, groupId).isEmpty()) {
        throw new NotFoundException("Group", groupId);
      }
      Recipient recipient = recipientStore.upsert(conn, normalized, name);
      if (groupId == null || Objects.equals(recipient.groupId(), groupId)) {
        return recipient;
      }
      recipientStore.assignToGroup(conn, groupId, List.of(recipient.id()));
      return recipientStore.findById(conn, recipient.id())
          .orElseThrow(() -> new NotFoundException("Recipient", recipient.id()));
    });
  }

  public Optional<Recipient> findRecipient(String email) {
    String normalized = requireEmail(email);
    return withConnection(conn -> recipientStore.findByEmail(conn, normalized));
  }

  /**
   * Returns the group with this name, creating it if needed.
   */
  public Group getOrCreateGroup(String name, String description) {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("group name cannot be blank");
    }
    return withConnection(conn -> groupStore.getOrCreate(conn, name.trim(), description));
  }

  public List<Group> listGroups() {
    return withConnection(groupStore::listAll);
  }

  /**
   * Renames a group or changes its description. A {@code null} argument keeps the current
   * value.
   *
   * @throws NotFoundException if the group does not exist
   */
  public Group updateGroup(long groupId, String name, String description) {
    return withConnection(conn -> {
      Group current = groupStore.findById(conn, groupId)
          .orElseThrow(() -> new NotFoundException("Group", groupId));
      String newName = name != null ? name.trim() : current.name();
      if (newName.isEmpty()) {
        throw new IllegalArgumentException("group name cannot be blank");
      }
      String newDescription = description != null ? description : current.description();
      return groupStore.update(conn, groupId, newName, newDescription);
    });
  }

  /**
   * @param activeOnly when {@code true}, opted-out members are left out
   * @throws NotFoundException if the group does not exist
   */
  public List<Recipient> listGroupMembers(long groupId, boolean activeOnly) {
    return withConnection(conn -> {
      if (groupStore.findById(conn, groupId).isEmpty()) {
        throw new NotFoundException("Group", groupId);
      }
      return recipientStore.listByGroup(conn, groupId, activeOnly);
    });
  }

  /**
   * Every recipient, optionally including opted-out ones.
   */
  public List<Recipient> listRecipients(boolean includeOptedOut) {
    return withConnection(conn -> recipientStore.listAll(conn, includeOptedOut));
  }

  /**
   * All recipients linked to a campaign, including opted-out ones.
   *
   * @throws NotFoundException if the campaign does not exist
   */
  public List<Recipient> listCampaignRecipients(long campaignId) {
    return withConnection(conn -> {
      requireCampaign(conn, campaignId);
      return recipientStore.listByCampaign(conn, campaignId);
    });
  }

  /**
   * Every campaign with its linked recipients, oldest first.
   */
  public List<CampaignOverview> listCampaigns() {
    return withConnection(conn -> {
      List<Campaign> campaigns = campaignStore.list(conn);
      List<CampaignOverview> overviews = new ArrayList<>(campaigns.size());
      for (Campaign campaign : campaigns) {
        overviews.add(new CampaignOverview(campaign, recipientStore.listByCampaign(conn, campaign.id())));
      }
      return overviews;
    });
  }

  /**
   * @throws NotFoundException if the campaign does not exist
   */
  public Campaign getCampaign(long campaignId) {
    return withConnection(conn -> requireCampaign(conn, campaignId));
  }

  /**
   * Per-recipient failures recorded by the campaign's last dispatch. Empty when the last
   * dispatch delivered to everyone or none has completed.
   *
   * @throws NotFoundException if the campaign does not exist
   */
  public List<DeliveryFailure> deliveryFailures(long campaignId) {
    return withConnection(conn -> {
      requireCampaign(conn, campaignId);
      return campaignStore.listDeliveryFailures(conn, campaignId);
    });
  }

  private Campaign requireCampaign(Connection conn, long campaignId) {
    return campaignStore.get(conn, campaignId)
        .orElseThrow(() -> new NotFoundException("Campaign", campaignId));
  }

  private static String requireEmail(String email) {
    Objects.requireNonNull(email, "email");
    String normalized = EmailAddresses.normalize(email);
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("email cannot be blank");
    }
    return normalized;
  }

  private <T> T withConnection(SqlCall<T> call) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return call.execute(conn);
    } catch (SQLException e) {
      throw new TransientStoreException("Directory operation failed", e);
    }
  }

  @FunctionalInterface
  private interface SqlCall<T> {
    T execute(Connection conn) throws SQLException;
  }
}
