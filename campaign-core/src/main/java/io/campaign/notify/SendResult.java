package io.campaign.notify;

import java.util.Objects;

/**
 * Outcome of a single {@link Notifier#send} call.
 */
public interface SendResult {

  static SendResult sent() {
    return Sent.INSTANCE;
  }

  static SendResult failed(String reason) {
    return new Failed(reason);
  }

  default boolean isSuccess() {
    return this instanceof Sent;
  }

  /** The notifier accepted the message. */
  record Sent() implements SendResult {
    static final Sent INSTANCE = new Sent();
  }

  /** The notifier rejected or could not deliver the message. */
  record Failed(String reason) implements SendResult {
    public Failed {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
