package alertgate.spring.boot;

import alertgate.AlertGateConfig;
import alertgate.AlertsApi;
import alertgate.command.RunOperationCommandExecutor;
import alertgate.dispatch.ChunkInterceptor;
import alertgate.dispatch.ChunkedDispatcher;
import alertgate.jdbc.DataSourceConnectionProvider;
import alertgate.jdbc.JdbcAlertQueries;
import alertgate.jdbc.JdbcCommandExecutor;
import alertgate.model.AlertKind;
import alertgate.spi.AlertQueries;
import alertgate.spi.CommandExecutor;
import alertgate.spi.ConnectionProvider;
import alertgate.spi.MetricsExporter;
import alertgate.suppression.SuppressionEngine;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.io.File;
import java.time.Clock;
import java.util.List;

/**
 * Auto-configuration for alert suppression and chunked dispatch.
 *
 * <p>Wires an {@link AlertsApi} from a {@link DataSource} and {@link AlertGateProperties}.
 * Status updates run in-process through {@link JdbcCommandExecutor} unless
 * {@code alertgate.executor.type=RUN_OPERATION} selects the external command line.
 *
 * @see AlertGateProperties
 * @see AlertGateMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(AlertsApi.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(AlertGateProperties.class)
public class AlertGateAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(AlertQueries.class)
  public JdbcAlertQueries alertQueries(ConnectionProvider connectionProvider, AlertGateProperties props) {
    var builder = JdbcAlertQueries.builder()
        .connectionProvider(connectionProvider)
        .tableName(AlertKind.TEST, props.getTables().getTest())
        .tableName(AlertKind.MODEL, props.getTables().getModel());
    if (props.getQueries().getDaysBack() != null) {
      builder.daysBack(props.getQueries().getDaysBack());
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean(CommandExecutor.class)
  public CommandExecutor commandExecutor(ConnectionProvider connectionProvider, AlertGateProperties props) {
    var executor = props.getExecutor();
    return switch (executor.getType()) {
      case JDBC -> new JdbcCommandExecutor(connectionProvider);
      case RUN_OPERATION -> RunOperationCommandExecutor.builder()
          .binary(executor.getBinary())
          .projectDir(executor.getProjectDir() != null ? new File(executor.getProjectDir()) : null)
          .profilesDir(executor.getProfilesDir())
          .target(executor.getTarget())
          .timeout(executor.getTimeout())
          .build();
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public SuppressionEngine suppressionEngine(AlertGateProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var suppression = props.getSuppression();
    return new SuppressionEngine(
        suppression.getPolicy().toPolicy(suppression.getDefaultInterval(), Clock.systemUTC()),
        metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ChunkedDispatcher chunkedDispatcher(AlertGateProperties props,
      CommandExecutor commandExecutor,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<ChunkInterceptor> interceptorProvider) {
    List<ChunkInterceptor> interceptors = interceptorProvider.orderedStream().toList();
    return ChunkedDispatcher.builder()
        .commandExecutor(commandExecutor)
        .defaultChunkSize(props.getChunkSize())
        .parallelism(props.getParallelism())
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .interceptors(interceptors)
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public AlertsApi alertsApi(AlertGateProperties props,
      AlertQueries alertQueries,
      ChunkedDispatcher chunkedDispatcher,
      SuppressionEngine suppressionEngine) {
    AlertGateConfig config = new AlertGateConfig()
        .setChunkSize(props.getChunkSize())
        .setParallelism(props.getParallelism())
        .setDeduplicate(props.isDeduplicate())
        .setSuppressionMode(props.getSuppression().getPolicy())
        .setDefaultSuppressionInterval(props.getSuppression().getDefaultInterval());
    for (AlertKind kind : AlertKind.values()) {
      config.setTableName(kind, props.getTables().forKind(kind));
    }
    return AlertsApi.builder()
        .alertQueries(alertQueries)
        .dispatcher(chunkedDispatcher)
        .suppressionEngine(suppressionEngine)
        .config(config)
        .build();
  }
}
