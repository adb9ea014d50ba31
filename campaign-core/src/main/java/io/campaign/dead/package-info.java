/**
 * Inspection and replay of jobs that ended in DEAD.
 */
package io.campaign.dead;
