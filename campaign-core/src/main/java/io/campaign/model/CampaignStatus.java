package io.campaign.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a campaign.
 *
 * <pre>
 * pending -> processing -> ready -> sending -> sent
 *                                           \-> send_failed -> sending (re-dispatch)
 * </pre>
 *
 * <p>{@code processing} belongs to linking and {@code sending} to dispatch. Neither job
 * accepts the other's in-flight status.
 *
 * <p>Each constant carries the lowercase code that is persisted in the {@code status} column.
 */
public enum CampaignStatus {
  PENDING("pending"),
  PROCESSING("processing"),
  READY("ready"),
  SENDING("sending"),
  SENT("sent"),
  SEND_FAILED("send_failed");

  private static final Set<CampaignStatus> LINKABLE = EnumSet.of(PENDING, PROCESSING, READY);
  private static final Set<CampaignStatus> DISPATCHABLE = EnumSet.of(READY, SEND_FAILED);

  private final String code;

  CampaignStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /** Statuses from which a linking job may (re)start ingestion. */
  public static Set<CampaignStatus> linkable() {
    return EnumSet.copyOf(LINKABLE);
  }

  /** Statuses from which a dispatch job may start. A redelivery may also resume {@code sending}. */
  public static Set<CampaignStatus> dispatchable() {
    return EnumSet.copyOf(DISPATCHABLE);
  }

  public boolean isLinkable() {
    return LINKABLE.contains(this);
  }

  public boolean isDispatchable() {
    return DISPATCHABLE.contains(this);
  }

  public boolean isTerminal() {
    return this == SENT || this == SEND_FAILED;
  }

  public static CampaignStatus fromCode(String code) {
    for (CampaignStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown campaign status: " + code);
  }
}
