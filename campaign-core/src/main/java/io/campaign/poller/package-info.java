/**
 * Scheduled fallback that claims pending and retry-due jobs from the store.
 */
package io.campaign.poller;
