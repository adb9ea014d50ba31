package io.campaign.notify;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Notifier that writes each message to the log instead of delivering it.
 * Registered for the {@code "email"} channel when no real transport is configured.
 */
public final class LoggingNotifier implements Notifier {
  private static final Logger logger = Logger.getLogger(LoggingNotifier.class.getName());

  private final String channel;

  public LoggingNotifier() {
    this(DefaultNotifierRegistry.EMAIL_CHANNEL);
  }

  public LoggingNotifier(String channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  @Override
  public String channel() {
    return channel;
  }

  @Override
  public SendResult send(String title, String message, String destination) {
    logger.info("[" + channel.toUpperCase() + "] '" + title + "' to " + destination + ": " + message);
    return SendResult.sent();
  }
}
