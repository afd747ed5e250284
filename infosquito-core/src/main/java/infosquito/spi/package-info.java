/**
 * Service Provider Interfaces (SPI) for plugging a broker client and a metrics backend
 * into the notifier.
 *
 * @see infosquito.spi.BrokerConnector
 * @see infosquito.spi.BrokerConnection
 * @see infosquito.spi.BrokerChannel
 * @see infosquito.spi.MetricsExporter
 */
package infosquito.spi;
