package io.campaign.model;

import java.time.Instant;

/**
 * Persisted campaign row.
 */
public record Campaign(
    long id,
    String title,
    String message,
    CampaignStatus status,
    Instant createdAt,
    Instant updatedAt
) {}
