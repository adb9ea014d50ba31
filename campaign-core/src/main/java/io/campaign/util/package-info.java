/**
 * Internal helpers: the job payload codec and the daemon thread factory.
 */
package io.campaign.util;
