package io.campaign.job;

import io.campaign.JobEnvelope;

/**
 * Runs one kind of job. Handlers must be idempotent: the queue delivers at least once.
 *
 * <p>Throwing a {@link io.campaign.CampaignException} fails the job permanently; any
 * other exception schedules a retry until the attempt budget is spent.
 *
 * @see JobHandlerRegistry
 */
@FunctionalInterface
public interface JobHandler {

  void handle(JobExecution execution) throws Exception;

  /**
   * Called once when a job has used up its attempts and was moved to DEAD.
   * Not called for permanent failures.
   *
   * @param job         the dead job
   * @param lastFailure the failure of the final attempt
   */
  default void onExhausted(JobEnvelope job, Exception lastFailure) {
  }
}
