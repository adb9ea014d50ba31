package io.campaign.model;

import java.time.Instant;

/**
 * Persisted recipient row, unique by normalized email.
 *
 * <p>{@code optOut} is the single source of truth for dispatch eligibility. {@code groupId}
 * is a weak reference and may be {@code null}.
 */
public record Recipient(
    long id,
    String email,
    String name,
    boolean optOut,
    String optOutReason,
    Long groupId,
    Instant createdAt,
    Instant updatedAt
) {

  public boolean isEligible() {
    return !optOut;
  }
}
