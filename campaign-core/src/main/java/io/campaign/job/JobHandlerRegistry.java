package io.campaign.job;

import io.campaign.model.JobKind;

public interface JobHandlerRegistry {

  /**
   * Returns the handler for {@code kind}, or {@code null} if none is registered.
   */
  JobHandler handlerFor(JobKind kind);
}
