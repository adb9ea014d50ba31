package io.campaign.notify;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Thread-safe, map-backed {@link NotifierRegistry}.
 *
 * <p>Registering a second notifier under an existing channel replaces the first.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * NotifierRegistry registry = new DefaultNotifierRegistry()
 *     .register(new SmtpNotifier(mailer))
 *     .register(new SmsNotifier(gateway));
 * }</pre>
 */
public final class DefaultNotifierRegistry implements NotifierRegistry {
  private static final Logger logger = Logger.getLogger(DefaultNotifierRegistry.class.getName());

  public static final String EMAIL_CHANNEL = "email";

  private final Map<String, Notifier> notifiers = new ConcurrentHashMap<>();
  private final String defaultChannel;

  /**
   * Creates a registry whose default channel is {@value #EMAIL_CHANNEL}.
   */
  public DefaultNotifierRegistry() {
    this(EMAIL_CHANNEL);
  }

  public DefaultNotifierRegistry(String defaultChannel) {
    Objects.requireNonNull(defaultChannel, "defaultChannel");
    if (defaultChannel.isBlank()) {
      throw new IllegalArgumentException("defaultChannel cannot be blank");
    }
    this.defaultChannel = defaultChannel;
  }

  /**
   * Registers a notifier under its {@link Notifier#channel()}.
   *
   * @param notifier the notifier
   * @return this registry for chaining
   */
  public DefaultNotifierRegistry register(Notifier notifier) {
    Objects.requireNonNull(notifier, "notifier");
    String channel = Objects.requireNonNull(notifier.channel(), "channel");
    Notifier previous = notifiers.put(channel, notifier);
    if (previous != null && previous != notifier) {
      logger.info("Replaced notifier for channel=" + channel + ": "
          + previous.getClass().getSimpleName() + " -> " + notifier.getClass().getSimpleName());
    }
    return this;
  }

  /**
   * Registers {@code notifier} only if its channel has no notifier yet.
   *
   * @return this registry for chaining
   */
  public DefaultNotifierRegistry registerIfAbsent(Notifier notifier) {
    Objects.requireNonNull(notifier, "notifier");
    notifiers.putIfAbsent(Objects.requireNonNull(notifier.channel(), "channel"), notifier);
    return this;
  }

  @Override
  public Notifier notifierFor(String channel) {
    return channel == null ? null : notifiers.get(channel);
  }

  @Override
  public String defaultChannel() {
    return defaultChannel;
  }

  @Override
  public Set<String> channels() {
    return Set.copyOf(notifiers.keySet());
  }
}
