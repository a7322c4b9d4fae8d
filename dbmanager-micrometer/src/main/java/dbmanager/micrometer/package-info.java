/**
 * Micrometer bridge: {@link dbmanager.micrometer.MicrometerMetricsExporter} exports transaction
 * counters and per-source health and pool gauges.
 */
package dbmanager.micrometer;
