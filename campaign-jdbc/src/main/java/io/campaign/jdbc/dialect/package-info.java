/**
 * Built-in dialects and the {@link io.campaign.jdbc.dialect.Dialects} registry.
 */
package io.campaign.jdbc.dialect;
