package io.campaign.spi;

/**
 * Observability hook for exporting job and delivery counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything.
 */
public interface MetricsExporter {

  MetricsExporter NOOP = new Noop();

  /** A submitted job was accepted by the hot queue. */
  void incrementHotEnqueued();

  /** A submitted job did not fit the hot queue and is left to the poller. */
  void incrementHotDropped();

  /** A polled job was accepted by the cold queue. */
  void incrementColdEnqueued();

  void incrementJobSuccess();

  /** A job failed and was rescheduled. */
  void incrementJobRetry();

  void incrementJobDead();

  /**
   * A job was postponed because another job for the same target was running.
   */
  default void incrementJobDeferred() {
  }

  /** One notifier call succeeded. */
  default void incrementSendSuccess() {
  }

  /** One notifier call failed or timed out. */
  default void incrementSendFailure() {
  }

  void recordQueueDepths(int hotDepth, int coldDepth);

  /**
   * Records the age of the oldest job returned by the last poll.
   *
   * @param lagMs lag in milliseconds (non-negative)
   */
  void recordOldestLagMs(long lagMs);

  /**
   * Records how long one job execution took, whatever its outcome.
   */
  default void recordJobDurationMs(long durationMs) {
  }

  final class Noop implements MetricsExporter {
    @Override
    public void incrementHotEnqueued() {
    }

    @Override
    public void incrementHotDropped() {
    }

    @Override
    public void incrementColdEnqueued() {
    }

    @Override
    public void incrementJobSuccess() {
    }

    @Override
    public void incrementJobRetry() {
    }

    @Override
    public void incrementJobDead() {
    }

    @Override
    public void recordQueueDepths(int hotDepth, int coldDepth) {
    }

    @Override
    public void recordOldestLagMs(long lagMs) {
    }
  }
}
