/**
 * Micrometer bridge for suppression and dispatch counters.
 *
 * @see alertgate.micrometer.MicrometerMetricsExporter
 */
package alertgate.micrometer;
