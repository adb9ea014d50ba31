/**
 * Immutable records and enums for recipients, groups, campaigns and queued jobs.
 */
package io.campaign.model;
