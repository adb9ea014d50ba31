/**
 * Job execution: a dual-queue dispatcher with per-target serialization, retry with
 * exponential backoff and a per-run timeout.
 *
 * @see io.campaign.dispatch.JobDispatcher
 * @see io.campaign.dispatch.InFlightTracker
 * @see io.campaign.dispatch.RetryPolicy
 */
package io.campaign.dispatch;
