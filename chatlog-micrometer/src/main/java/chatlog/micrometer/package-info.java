/**
 * Micrometer integration for chat log metrics.
 *
 * @see chatlog.micrometer.MicrometerMetricsExporter
 */
package chatlog.micrometer;
