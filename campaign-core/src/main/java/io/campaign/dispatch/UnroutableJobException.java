package io.campaign.dispatch;

import io.campaign.CampaignException;

/**
 * Thrown when a job cannot be routed: no handler is registered for its kind, or no
 * notifier is registered for the dispatch channel.
 *
 * <p>The dispatcher treats this as a non-retryable failure and immediately marks the
 * job as DEAD.
 */
public final class UnroutableJobException extends CampaignException {

    public UnroutableJobException(String message) {
        super(message);
    }
}
