package io.campaign;

/**
 * Base class for domain failures that retrying cannot fix.
 *
 * <p>The job dispatcher moves a job that fails with a {@code CampaignException} straight to
 * DEAD instead of scheduling another attempt.
 */
public class CampaignException extends RuntimeException {

  public CampaignException(String message) {
    super(message);
  }

  public CampaignException(String message, Throwable cause) {
    super(message, cause);
  }
}
