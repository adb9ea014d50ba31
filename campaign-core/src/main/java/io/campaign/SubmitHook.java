package io.campaign;

/**
 * Callback invoked by {@link JobSubmitter} once a job row has been committed.
 *
 * <p>Use {@link io.campaign.dispatch.DispatcherSubmitHook} to hand the job straight to the
 * dispatcher's hot queue. The {@link #NOOP} instance does nothing, leaving every job for the
 * poller. Exceptions thrown from {@link #afterCommit} are logged and swallowed; the job is
 * already durable.
 */
@FunctionalInterface
public interface SubmitHook {

    void afterCommit(JobEnvelope job);

    SubmitHook NOOP = job -> {
    };
}
