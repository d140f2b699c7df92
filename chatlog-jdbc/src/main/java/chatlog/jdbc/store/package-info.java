/**
 * JDBC implementations of {@link chatlog.spi.LiveMessageStore} and
 * {@link chatlog.spi.ArchiveMessageStore}.
 *
 * <p>{@link chatlog.jdbc.store.AbstractJdbcMessageStore} holds the shared SQL and row
 * mapping; subclasses supply the archive upsert: H2 ({@code MERGE ... KEY}), MySQL
 * ({@code ON DUPLICATE KEY UPDATE}) and PostgreSQL ({@code ON CONFLICT}).
 *
 * @see chatlog.jdbc.store.JdbcMessageStores
 */
package chatlog.jdbc.store;
