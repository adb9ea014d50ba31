package io.campaign.poller;

import io.campaign.JobEnvelope;

/**
 * Receives jobs claimed by the {@link JobPoller}.
 *
 * @see io.campaign.dispatch.DispatcherPollerHandler
 */
@FunctionalInterface
public interface JobPollerHandler {

    /**
     * Handles a polled job.
     *
     * @param job the job decoded from its row
     * @return {@code true} if accepted, {@code false} to signal back-pressure (ends the current batch)
     */
    boolean handle(JobEnvelope job);

    /**
     * Number of jobs this handler can take right now. The poller never claims more rows than
     * this and skips the cycle when it is {@code 0}.
     *
     * <p>Default returns {@link Integer#MAX_VALUE}.
     */
    default int availableCapacity() {
        return Integer.MAX_VALUE;
    }
}
