package chatlog.spi;

import chatlog.model.ArchivedMessage;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the archive table: the unbounded, append-mostly set of
 * messages relocated out of the live table.
 *
 * @see LiveMessageStore
 * @see chatlog.jdbc.store.AbstractJdbcMessageStore
 */
public interface ArchiveMessageStore {

  /**
   * Writes an archived message. A row with the same id, left by an interrupted earlier
   * relocation, is replaced rather than duplicated.
   *
   * @param conn    the JDBC connection (typically inside a relocation transaction)
   * @param message the message with its relocation time
   */
  void upsert(Connection conn, ArchivedMessage message);

  /**
   * Writes several archived messages.
   *
   * <p>Default loops {@link #upsert}.
   */
  default void upsertBatch(Connection conn, List<ArchivedMessage> messages) {
    for (ArchivedMessage message : messages) {
      upsert(conn, message);
    }
  }

  /**
   * Returns every archived message in archive insertion order.
   */
  List<ArchivedMessage> findAllArchived(Connection conn);

  /**
   * Looks up one archived message.
   */
  Optional<ArchivedMessage> findArchivedById(Connection conn, String id);

  /**
   * Removes one archived message.
   *
   * @return the number of rows deleted (0 or 1)
   */
  int deleteArchived(Connection conn, String id);

  /**
   * Counts archived messages.
   */
  int countArchived(Connection conn);
}
