package io.campaign.notify;

/**
 * A delivery channel (email, SMS, push, ...) able to send one message to one destination.
 *
 * <p>Implementations must be thread-safe: a dispatch run calls {@link #send} concurrently
 * from several sender threads. A notifier may report failure either by returning
 * {@link SendResult.Failed} or by throwing; both count as a failed delivery for that
 * destination only.
 *
 * @see NotifierRegistry
 */
public interface Notifier {

  /**
   * Channel name this notifier is registered under, e.g. {@code "email"}.
   */
  String channel();

  /**
   * Sends one message.
   *
   * @param title       campaign title
   * @param message     campaign body
   * @param destination channel-specific address (a normalized email for {@code "email"})
   * @return the delivery outcome
   * @throws Exception on transport failure; treated as {@link SendResult.Failed}
   */
  SendResult send(String title, String message, String destination) throws Exception;
}
