package io.campaign.job;

import io.campaign.model.JobKind;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry holding at most one handler per {@link JobKind}.
 */
public final class DefaultJobHandlerRegistry implements JobHandlerRegistry {
  private final Map<JobKind, JobHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Registers the handler for {@code kind}, replacing any previous one.
   *
   * @return this registry for chaining
   */
  public DefaultJobHandlerRegistry register(JobKind kind, JobHandler handler) {
    handlers.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(handler, "handler"));
    return this;
  }

  @Override
  public JobHandler handlerFor(JobKind kind) {
    return kind == null ? null : handlers.get(kind);
  }
}
