package io.campaign.model;

/**
 * A recipient the notifier could not deliver to during a dispatch run.
 */
public record DeliveryFailure(String email, String reason) {}
