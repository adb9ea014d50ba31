package io.campaign.spi;

import io.campaign.model.Group;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for recipient groups, unique by name.
 */
public interface GroupStore {

  Optional<Group> findById(Connection conn, long groupId);

  Optional<Group> findByName(Connection conn, String name);

  /**
   * Every group, in creation order.
   */
  List<Group> listAll(Connection conn);

  /**
   * Returns the group named {@code name}, creating it with {@code description} if absent.
   * An existing group's description is left unchanged.
   */
  Group getOrCreate(Connection conn, String name, String description);

  /**
   * Renames a group and replaces its description.
   *
   * @throws io.campaign.NotFoundException if the group does not exist
   */
  Group update(Connection conn, long groupId, String name, String description);
}
