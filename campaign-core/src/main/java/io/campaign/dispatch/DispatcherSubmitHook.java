package io.campaign.dispatch;

import io.campaign.JobEnvelope;
import io.campaign.SubmitHook;
import io.campaign.spi.MetricsExporter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bridges {@link io.campaign.JobSubmitter} to the dispatcher's hot queue. A job that does
 * not fit is left in the store for the poller.
 */
public final class DispatcherSubmitHook implements SubmitHook {
    private static final Logger logger = Logger.getLogger(DispatcherSubmitHook.class.getName());

    private final JobDispatcher dispatcher;
    private final MetricsExporter metrics;

    public DispatcherSubmitHook(JobDispatcher dispatcher) {
        this(dispatcher, null);
    }

    public DispatcherSubmitHook(JobDispatcher dispatcher, MetricsExporter metrics) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    }

    @Override
    public void afterCommit(JobEnvelope job) {
        try {
            if (dispatcher.enqueueHot(new QueuedJob(job, QueuedJob.Source.HOT))) {
                metrics.incrementHotEnqueued();
            } else {
                metrics.incrementHotDropped();
                logger.log(Level.WARNING, "Hot queue full, falling back to poller for jobId=" + job.jobId());
            }
        } catch (RuntimeException ex) {
            metrics.incrementHotDropped();
            logger.log(Level.WARNING, "Failed to enqueue hot job, falling back to poller for jobId=" + job.jobId(), ex);
        }
    }
}
