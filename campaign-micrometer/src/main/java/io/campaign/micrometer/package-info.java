/**
 * Micrometer bridge for exporting campaign job metrics to Prometheus, Grafana, and other
 * backends.
 *
 * @see io.campaign.micrometer.MicrometerMetricsExporter
 */
package io.campaign.micrometer;
