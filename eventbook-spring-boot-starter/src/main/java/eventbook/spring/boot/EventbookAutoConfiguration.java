package eventbook.spring.boot;

import eventbook.Eventbook;
import eventbook.EventbookConfig;
import eventbook.connection.ConnectionManager;
import eventbook.jdbc.DataSourceConnector;
import eventbook.jdbc.HikariDatabaseConnector;
import eventbook.jdbc.TableNames;
import eventbook.jdbc.store.AbstractJdbcEventStore;
import eventbook.jdbc.store.JdbcBookingStore;
import eventbook.jdbc.store.JdbcEventStores;
import eventbook.spi.BookingStore;
import eventbook.spi.DatabaseConnector;
import eventbook.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import javax.sql.DataSource;

/**
 * Auto-configuration for eventbook.
 *
 * <p>Wires a {@link ConnectionManager} and an {@link Eventbook} composite from
 * {@link EventbookProperties}. When the context already has a {@link DataSource}, the
 * manager adopts it; otherwise it opens its own HikariCP pool on first use.
 *
 * @see EventbookProperties
 * @see EventbookMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Eventbook.class)
@EnableConfigurationProperties(EventbookProperties.class)
public class EventbookAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public EventbookConfig eventbookConfig(EventbookProperties props, Environment environment) {
    return props.toConfig(environment);
  }

  @Bean
  @ConditionalOnMissingBean
  public DatabaseConnector databaseConnector(ObjectProvider<DataSource> dataSourceProvider) {
    DataSource dataSource = dataSourceProvider.getIfUnique();
    return dataSource != null ? new DataSourceConnector(dataSource) : new HikariDatabaseConnector();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ConnectionManager connectionManager(EventbookConfig config,
      DatabaseConnector connector,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return ConnectionManager.builder()
        .config(config)
        .connector(connector)
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcEventStore eventStore(EventbookConfig config, EventbookProperties props) {
    AbstractJdbcEventStore detected = JdbcEventStores.detect(config.databaseUrl());
    if (!TableNames.EVENTS.equals(props.getEventsTable())) {
      return detected.withTableName(props.getEventsTable());
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(BookingStore.class)
  public JdbcBookingStore bookingStore(EventbookProperties props) {
    return new JdbcBookingStore(props.getBookingsTable());
  }

  @Bean
  @ConditionalOnProperty(prefix = "eventbook", name = "initialize-schema", havingValue = "true")
  public EventbookSchemaInitializer eventbookSchemaInitializer(ConnectionManager connectionManager,
      AbstractJdbcEventStore eventStore, EventbookProperties props) {
    return new EventbookSchemaInitializer(connectionManager, eventStore.name(),
        props.getEventsTable(), props.getBookingsTable());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Eventbook eventbook(ConnectionManager connectionManager,
      AbstractJdbcEventStore eventStore,
      BookingStore bookingStore,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = Eventbook.builder()
        .connectionManager(connectionManager)
        .eventStore(eventStore)
        .bookingStore(bookingStore);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
