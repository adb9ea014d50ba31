package io.campaign.model;

import java.time.Instant;

/**
 * Named grouping of recipients, independent of campaign membership.
 */
public record Group(
    long id,
    String name,
    String description,
    Instant createdAt,
    Instant updatedAt
) {}
