package io.campaign.dispatch;

import io.campaign.JobEnvelope;
import io.campaign.poller.JobPollerHandler;

import java.util.Objects;

/**
 * Forwards jobs found by {@link io.campaign.poller.JobPoller} to the dispatcher's cold queue.
 */
public final class DispatcherPollerHandler implements JobPollerHandler {
  private final JobDispatcher dispatcher;

  public DispatcherPollerHandler(JobDispatcher dispatcher) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
  }

  @Override
  public int availableCapacity() {
    return dispatcher.coldQueueRemainingCapacity();
  }

  @Override
  public boolean handle(JobEnvelope job) {
    return dispatcher.enqueueCold(new QueuedJob(job, QueuedJob.Source.COLD));
  }
}
