package io.campaign.notify;

import java.util.Set;

/**
 * Looks up notifiers by channel name.
 *
 * @see DefaultNotifierRegistry
 */
public interface NotifierRegistry {

  /**
   * Returns the notifier for {@code channel}, or {@code null} if none is registered.
   */
  Notifier notifierFor(String channel);

  /**
   * Channel used by campaign dispatch.
   */
  String defaultChannel();

  Set<String> channels();
}
