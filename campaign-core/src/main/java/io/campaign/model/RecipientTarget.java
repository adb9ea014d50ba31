package io.campaign.model;

import java.util.Objects;

/**
 * One raw entry of a job's address list: an email as submitted plus an optional display name.
 */
public record RecipientTarget(String email, String name) {

  public RecipientTarget {
    Objects.requireNonNull(email, "email");
  }

  public static RecipientTarget of(String email) {
    return new RecipientTarget(email, null);
  }
}
