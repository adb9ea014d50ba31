package io.campaign.dispatch;

import io.campaign.JobEnvelope;

/**
 * Pairs a {@link JobEnvelope} with the queue it arrived on.
 */
public record QueuedJob(JobEnvelope job, Source source) {

  /** Whether a job came straight from the submitter or was picked up by the poller. */
  public enum Source {
    /** Enqueued right after the submitting transaction committed. */
    HOT,
    /** Enqueued by the poller from the database. */
    COLD
  }
}
