package io.campaign.model;

import java.time.Instant;

/**
 * Read-only view of a persisted job row, as returned by the poller claim, the dispatcher
 * claim and the dead-job queries.
 *
 * <p>{@code attempts} counts failed runs (incremented on retry); {@code deliveries} counts
 * every time a worker claimed the row for execution, so a value above one means the job
 * is being redelivered.
 *
 * @see io.campaign.spi.JobStore
 */
public record JobRecord(
    String jobId,
    JobKind kind,
    long targetId,
    String payloadJson,
    JobStatus status,
    int attempts,
    int deliveries,
    Instant createdAt,
    String lastError
) {}
