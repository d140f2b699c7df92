package chatlog.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC message stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/chatlog.jdbc.store.AbstractJdbcMessageStore}.
 *
 * <pre>{@code
 * AbstractJdbcMessageStore store = JdbcMessageStores.detect(dataSource)
 *     .withTables("team_messages", "team_messages_archive");
 * }</pre>
 */
public final class JdbcMessageStores {

  private static final List<AbstractJdbcMessageStore> STORES;
  private static final Map<String, AbstractJdbcMessageStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcMessageStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcMessageStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcMessageStores() {
  }

  /**
   * Returns all registered stores.
   */
  public static List<AbstractJdbcMessageStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name.
   *
   * @param name store name (case-insensitive)
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcMessageStore get(String name) {
    AbstractJdbcMessageStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown message store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Detects the store from the URL of a {@link DataSource} connection.
   *
   * @throws IllegalStateException if the URL cannot be read
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcMessageStore detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect message store from DataSource", e);
    }
    return detect(url);
  }

  /**
   * Detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcMessageStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcMessageStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No message store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
