package io.campaign.micrometer;

import io.campaign.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code campaign.enqueue.hot}: jobs handed to the hot queue on submit</li>
 *   <li>{@code campaign.enqueue.hot.dropped}: jobs left to the poller (hot queue full)</li>
 *   <li>{@code campaign.enqueue.cold}: jobs enqueued by the poller</li>
 *   <li>{@code campaign.job.success}, {@code campaign.job.retry}, {@code campaign.job.dead}</li>
 *   <li>{@code campaign.job.deferred}: jobs postponed behind a running job for the same target</li>
 *   <li>{@code campaign.send.success}, {@code campaign.send.failure}: single notifier calls</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code campaign.queue.hot.depth}, {@code campaign.queue.cold.depth}</li>
 *   <li>{@code campaign.lag.oldest.ms}: age of the oldest job seen by the last poll</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code campaign.job.duration.ms}: handler execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "campaign";

  private final MeterRegistry registry;
  private final Counter hotEnqueued;
  private final Counter hotDropped;
  private final Counter coldEnqueued;
  private final Counter jobSuccess;
  private final Counter jobRetry;
  private final Counter jobDead;
  private final Counter jobDeferred;
  private final Counter sendSuccess;
  private final Counter sendFailure;
  private final Gauge hotDepthGauge;
  private final Gauge coldDepthGauge;
  private final Gauge lagGauge;
  private final DistributionSummary jobDuration;

  private final AtomicInteger hotDepth = new AtomicInteger();
  private final AtomicInteger coldDepth = new AtomicInteger();
  private final AtomicLong oldestLagMs = new AtomicLong();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names, e.g. {@code "newsletter.campaign"}
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.hotEnqueued = counter(namePrefix + ".enqueue.hot", "Jobs enqueued via hot path");
    this.hotDropped = counter(namePrefix + ".enqueue.hot.dropped", "Jobs left to the poller (hot queue full)");
    this.coldEnqueued = counter(namePrefix + ".enqueue.cold", "Jobs enqueued via cold (poller) path");
    this.jobSuccess = counter(namePrefix + ".job.success", "Jobs completed");
    this.jobRetry = counter(namePrefix + ".job.retry", "Jobs failed and rescheduled");
    this.jobDead = counter(namePrefix + ".job.dead", "Jobs moved to DEAD");
    this.jobDeferred = counter(namePrefix + ".job.deferred", "Jobs postponed behind a busy target");
    this.sendSuccess = counter(namePrefix + ".send.success", "Notifier calls that delivered");
    this.sendFailure = counter(namePrefix + ".send.failure", "Notifier calls that failed or timed out");

    this.hotDepthGauge = Gauge.builder(namePrefix + ".queue.hot.depth", hotDepth, AtomicInteger::get)
        .register(registry);
    this.coldDepthGauge = Gauge.builder(namePrefix + ".queue.cold.depth", coldDepth, AtomicInteger::get)
        .register(registry);
    this.lagGauge = Gauge.builder(namePrefix + ".lag.oldest.ms", oldestLagMs, AtomicLong::get)
        .register(registry);
    this.jobDuration = DistributionSummary.builder(namePrefix + ".job.duration.ms")
        .description("Job handler execution time")
        .baseUnit("milliseconds")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementHotEnqueued() {
    if (closed) return;
    hotEnqueued.increment();
  }

  @Override
  public void incrementHotDropped() {
    if (closed) return;
    hotDropped.increment();
  }

  @Override
  public void incrementColdEnqueued() {
    if (closed) return;
    coldEnqueued.increment();
  }

  @Override
  public void incrementJobSuccess() {
    if (closed) return;
    jobSuccess.increment();
  }

  @Override
  public void incrementJobRetry() {
    if (closed) return;
    jobRetry.increment();
  }

  @Override
  public void incrementJobDead() {
    if (closed) return;
    jobDead.increment();
  }

  @Override
  public void incrementJobDeferred() {
    if (closed) return;
    jobDeferred.increment();
  }

  @Override
  public void incrementSendSuccess() {
    if (closed) return;
    sendSuccess.increment();
  }

  @Override
  public void incrementSendFailure() {
    if (closed) return;
    sendFailure.increment();
  }

  @Override
  public void recordQueueDepths(int hotDepth, int coldDepth) {
    if (closed) return;
    this.hotDepth.set(hotDepth);
    this.coldDepth.set(coldDepth);
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    if (closed) return;
    this.oldestLagMs.set(lagMs);
  }

  @Override
  public void recordJobDurationMs(long durationMs) {
    if (closed) return;
    jobDuration.record(durationMs);
  }

  /**
   * Removes every meter this exporter registered. {@link io.campaign.CampaignJobs} calls
   * this on close.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(hotEnqueued, hotDropped, coldEnqueued, jobSuccess, jobRetry, jobDead,
        jobDeferred, sendSuccess, sendFailure, hotDepthGauge, coldDepthGauge, lagGauge, jobDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
