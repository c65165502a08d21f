package offlinesync.spring.boot;

import offlinesync.MessageDelivery;
import offlinesync.OfflineSync;
import offlinesync.connectivity.HeartbeatConnectivityProbe;
import offlinesync.connectivity.ManualConnectivityProbe;
import offlinesync.event.DefaultEventBus;
import offlinesync.event.EventBus;
import offlinesync.event.QueueEventListener;
import offlinesync.jdbc.DataSourceConnectionProvider;
import offlinesync.jdbc.store.AbstractJdbcMessageStore;
import offlinesync.jdbc.store.JdbcMessageStores;
import offlinesync.queue.FailedMessageManager;
import offlinesync.queue.QueueManager;
import offlinesync.spi.ConnectionProvider;
import offlinesync.spi.ConnectivityProbe;
import offlinesync.spi.MessageStore;
import offlinesync.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the offline message queue.
 *
 * <p>Detects the message store from the {@link DataSource} and, once the application
 * provides a {@link MessageDelivery} bean, starts an {@link OfflineSync} composite.
 * Every {@link QueueEventListener} bean is subscribed to the event bus before startup.
 *
 * @see OfflineSyncProperties
 * @see OfflineSyncMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(OfflineSync.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(OfflineSyncProperties.class)
public class OfflineSyncAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MessageStore.class)
  public AbstractJdbcMessageStore messageStore(DataSource dataSource, OfflineSyncProperties props) {
    return JdbcMessageStores.detect(dataSource, props.getTableName());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(EventBus.class)
  public DefaultEventBus eventBus() {
    return new DefaultEventBus();
  }

  @Bean
  @ConditionalOnMissingBean(ConnectivityProbe.class)
  public ConnectivityProbe connectivityProbe(OfflineSyncProperties props) {
    OfflineSyncProperties.Connectivity connectivity = props.getConnectivity();
    String host = connectivity.getHeartbeatHost();
    if (host == null || host.isBlank()) {
      return new ManualConnectivityProbe(connectivity.isInitiallyOnline());
    }
    return HeartbeatConnectivityProbe.builder()
        .host(host)
        .port(connectivity.getHeartbeatPort())
        .interval(connectivity.getHeartbeatInterval())
        .connectTimeout(connectivity.getConnectTimeout())
        .initiallyOnline(connectivity.isInitiallyOnline())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(MessageDelivery.class)
  public OfflineSync offlineSync(OfflineSyncProperties props,
      ConnectionProvider connectionProvider,
      MessageStore messageStore,
      MessageDelivery delivery,
      ConnectivityProbe connectivityProbe,
      EventBus eventBus,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<QueueEventListener> listenerProvider) {

    listenerProvider.orderedStream().forEach(eventBus::subscribe);

    var builder = OfflineSync.builder()
        .connectionProvider(connectionProvider)
        .messageStore(messageStore)
        .delivery(delivery)
        .connectivityProbe(connectivityProbe)
        .eventBus(eventBus)
        .maxRetries(props.getMaxRetries())
        .deliveryTimeout(props.getDeliveryTimeout())
        .syncOnStart(props.isSyncOnStart())
        .resyncInterval(props.getResyncInterval())
        .drainTimeoutMs(props.getDrainTimeout().toMillis());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(MessageDelivery.class)
  public QueueManager queueManager(OfflineSync offlineSync) {
    return offlineSync.queue();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(MessageDelivery.class)
  public FailedMessageManager failedMessageManager(OfflineSync offlineSync) {
    return offlineSync.failedMessages();
  }
}
