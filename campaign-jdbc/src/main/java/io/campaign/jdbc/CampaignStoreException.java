package io.campaign.jdbc;

import io.campaign.TransientStoreException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the stores in this module. Workers
 * treat it as transient: the job is retried with backoff.
 */
public final class CampaignStoreException extends TransientStoreException {

  public CampaignStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public CampaignStoreException(String message) {
    super(message, null);
  }
}
