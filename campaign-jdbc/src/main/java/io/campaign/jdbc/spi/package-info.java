/**
 * Service provider interface for database dialects.
 */
package io.campaign.jdbc.spi;
