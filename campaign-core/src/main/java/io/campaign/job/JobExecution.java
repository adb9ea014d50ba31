package io.campaign.job;

import io.campaign.JobEnvelope;

import java.util.Objects;

/**
 * One claimed run of a job.
 *
 * @param job      the job being run
 * @param attempts failed runs recorded before this one
 * @param delivery 1 for the first time any worker claims the job, higher on redelivery
 *                 (after a failure, a timeout, or a worker that never reported back)
 */
public record JobExecution(JobEnvelope job, int attempts, int delivery) {

  public JobExecution {
    Objects.requireNonNull(job, "job");
  }

  public static JobExecution first(JobEnvelope job) {
    return new JobExecution(job, 0, 1);
  }

  public boolean isRedelivery() {
    return delivery > 1;
  }
}
