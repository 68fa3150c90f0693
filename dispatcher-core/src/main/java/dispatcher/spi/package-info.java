/**
 * Service Provider Interfaces (SPI) for extending the dispatcher.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in identifier generation and metrics export.
 *
 * @see dispatcher.spi.IdGenerator
 * @see dispatcher.spi.MetricsExporter
 */
package dispatcher.spi;
