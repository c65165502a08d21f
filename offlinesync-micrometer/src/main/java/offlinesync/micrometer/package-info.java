/**
 * Micrometer bridge for exporting queue and sync metrics to Prometheus, Grafana, and other backends.
 *
 * @see offlinesync.micrometer.MicrometerMetricsExporter
 */
package offlinesync.micrometer;
