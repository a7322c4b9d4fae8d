/**
 * Service Provider Interfaces (SPI) for plugging in data-source drivers and metrics.
 *
 * @see dbmanager.spi.DataSourceDriver
 * @see dbmanager.spi.DataSourceHandle
 * @see dbmanager.spi.ConnectionPool
 * @see dbmanager.spi.ConnectionProvider
 * @see dbmanager.spi.MetricsExporter
 */
package dbmanager.spi;
