package chatlog.spring.boot;

import chatlog.ChatLog;
import chatlog.ConfigurationException;
import chatlog.jdbc.DataSourceConnectionProvider;
import chatlog.jdbc.JdbcSchema;
import chatlog.jdbc.store.AbstractJdbcMessageStore;
import chatlog.jdbc.store.JdbcMessageStores;
import chatlog.retry.ExponentialBackoffRetryPolicy;
import chatlog.spi.ConnectionProvider;
import chatlog.spi.MetricsExporter;
import chatlog.thought.ThoughtLog;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Auto-configuration for the chat log.
 *
 * <p>Detects the message store from the {@link DataSource} URL and wires a {@link ChatLog}
 * from {@link ChatLogProperties}. With {@code chatlog.compaction.scheduled=true} the chat
 * log also runs background compaction.
 *
 * @see ChatLogProperties
 * @see ChatLogMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(ChatLog.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(ChatLogProperties.class)
public class ChatLogAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcMessageStore messageStore(DataSource dataSource, ChatLogProperties props) {
    AbstractJdbcMessageStore store = JdbcMessageStores.detect(dataSource)
        .withTables(props.getLiveTable(), props.getArchiveTable())
        .withQueryTimeout(props.getQueryTimeoutSeconds());
    if (props.isInitializeSchema()) {
      try (Connection conn = dataSource.getConnection()) {
        JdbcSchema.create(conn, store.name(), store.liveTable(), store.archiveTable());
      } catch (SQLException e) {
        throw new ConfigurationException("Failed to initialize chat log schema", e);
      }
    }
    return store;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider chatLogConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ChatLog chatLog(ChatLogProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcMessageStore messageStore,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var compaction = props.getCompaction();
    var retry = props.getRetry();
    var builder = ChatLog.builder()
        .connectionProvider(connectionProvider)
        .liveStore(messageStore)
        .archiveStore(messageStore)
        .mergeWindow(props.getMergeWindow())
        .defaultSender(props.getDefaultSender())
        .defaultRecipient(props.getDefaultRecipient())
        .recentLimit(props.getRecent().getLimit())
        .recentScanLimit(props.getRecent().getScanLimit())
        .keepLive(compaction.getKeepLive())
        .maxPerRun(compaction.getMaxPerRun())
        .relocationBatchSize(compaction.getBatchSize())
        .defaultPageSize(props.getArchive().getDefaultPageSize())
        .maxPageSize(props.getArchive().getMaxPageSize())
        .thinker(props.getThoughts().getThinker())
        .maxAttempts(retry.getMaxAttempts())
        .retryPolicy(new ExponentialBackoffRetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs()));
    if (compaction.isScheduled()) {
      builder.compactionIntervalSeconds(compaction.getIntervalSeconds());
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ThoughtLog thoughtLog(ChatLog chatLog) {
    return chatLog.thoughts();
  }
}
