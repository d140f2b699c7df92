/**
 * Service Provider Interfaces (SPI) for plugging the chat log into a database and a
 * metrics backend.
 *
 * @see chatlog.spi.ConnectionProvider
 * @see chatlog.spi.LiveMessageStore
 * @see chatlog.spi.ArchiveMessageStore
 * @see chatlog.spi.MetricsExporter
 */
package chatlog.spi;
