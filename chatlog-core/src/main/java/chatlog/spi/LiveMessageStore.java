package chatlog.spi;

import chatlog.model.StoredMessage;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the live message table: the small, frequently read and written
 * set of current messages.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls transaction
 * boundaries. Read methods return rows in insertion order; they never sort by the stored
 * timestamp, because mixed encodings do not order correctly inside the database.
 * Implementations live in the {@code chatlog-jdbc} module.
 *
 * @see chatlog.jdbc.store.AbstractJdbcMessageStore
 */
public interface LiveMessageStore {

  /**
   * Maximum number of write operations the chat log issues inside one transaction.
   */
  int MAX_BATCH_OPERATIONS = 500;

  /**
   * Inserts a new message.
   *
   * @param conn    the JDBC connection
   * @param message the message to persist
   */
  void insert(Connection conn, StoredMessage message);

  /**
   * Returns every live message in insertion order.
   */
  List<StoredMessage> findAll(Connection conn);

  /**
   * Returns the live messages of one sender in insertion order.
   */
  List<StoredMessage> findBySender(Connection conn, String sender);

  /**
   * Looks up one live message.
   */
  Optional<StoredMessage> findById(Connection conn, String id);

  /**
   * Replaces the text of a message and sets its timestamp, but only if the row is still at
   * {@code expectedRevision}. The revision is incremented on success.
   *
   * @param conn             the JDBC connection
   * @param id               message id
   * @param expectedRevision revision observed when the merge was decided
   * @param text             the full merged text
   * @param mergedAt         new structured timestamp
   * @return 1 if updated, 0 if the row is gone or was changed concurrently
   */
  int updateMerged(Connection conn, String id, long expectedRevision, String text, Instant mergedAt);

  /**
   * Deletes one message.
   *
   * @return the number of rows deleted (0 or 1)
   */
  int delete(Connection conn, String id);

  /**
   * Deletes one message only if it is still at {@code expectedRevision}.
   *
   * @return the number of rows deleted (0 or 1)
   */
  int deleteIfUnchanged(Connection conn, String id, long expectedRevision);

  /**
   * Deletes the given ids. Callers keep each call within {@link #MAX_BATCH_OPERATIONS} ids.
   *
   * @return the number of rows deleted
   */
  int deleteAll(Connection conn, Collection<String> ids);

  /**
   * Deletes every message whose sender equals {@code sender}.
   *
   * @return the number of rows deleted
   */
  int deleteBySender(Connection conn, String sender);

  /**
   * Counts live messages.
   */
  int count(Connection conn);
}
