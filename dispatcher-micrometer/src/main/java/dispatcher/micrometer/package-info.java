/**
 * Micrometer bridge for exporting dispatcher metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link dispatcher.micrometer.MicrometerMetricsExporter} implements the
 * {@link dispatcher.spi.MetricsExporter} SPI using Micrometer counters, a gauge and
 * distribution summaries.
 *
 * @see dispatcher.micrometer.MicrometerMetricsExporter
 */
package dispatcher.micrometer;
