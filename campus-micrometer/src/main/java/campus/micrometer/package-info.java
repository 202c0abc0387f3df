/**
 * Micrometer bridge for exporting outbox and processor metrics.
 *
 * @see campus.micrometer.MicrometerMetricsExporter
 */
package campus.micrometer;
