/**
 * Core API of the campaign dispatch pipeline.
 *
 * <p>{@link io.campaign.JobSubmitter} persists a {@link io.campaign.JobEnvelope} and hands it to
 * the dispatcher; {@link io.campaign.CampaignJobs} wires submitter, dispatcher, poller and the
 * job handlers into one closeable unit.
 */
package io.campaign;
