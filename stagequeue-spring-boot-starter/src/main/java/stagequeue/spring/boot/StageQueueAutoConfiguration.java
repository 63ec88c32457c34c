package stagequeue.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import stagequeue.ReleaseInterceptor;
import stagequeue.SimClock;
import stagequeue.StageScheduler;
import stagequeue.jdbc.JdbcStageStores;
import stagequeue.model.Stage;
import stagequeue.optimizer.OptimizerResolver;
import stagequeue.optimizer.process.JacksonJsonCodec;
import stagequeue.optimizer.process.ScriptOptimizerResolver;
import stagequeue.spi.ConnectionProvider;
import stagequeue.spi.MetricsExporter;
import stagequeue.util.JsonCodec;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Auto-configuration for the stage scheduler.
 *
 * <p>Wires a {@link StageScheduler} from a {@link DataSource}, the JDBC stores and
 * {@link StageQueueProperties}. Optimizers are external scripts resolved per stage by
 * {@link ScriptOptimizerResolver}.
 *
 * @see StageQueueProperties
 * @see StageQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(StageScheduler.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(StageQueueProperties.class)
public class StageQueueAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public JsonCodec stageQueueJsonCodec(ObjectProvider<ObjectMapper> objectMapper) {
    ObjectMapper mapper = objectMapper.getIfAvailable();
    return mapper != null ? new JacksonJsonCodec(mapper) : JsonCodec.getDefault();
  }

  @Bean
  @ConditionalOnMissingBean
  public JdbcStageStores stageStores(StageQueueProperties props, JsonCodec jsonCodec) {
    return JdbcStageStores.create(props.getTablePrefix(), jsonCodec);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public ConnectionProvider connectionProvider(DataSource dataSource) {
    return dataSource::getConnection;
  }

  @Bean
  @ConditionalOnMissingBean
  public OptimizerResolver optimizerResolver(StageQueueProperties props) {
    StageQueueProperties.Optimizer opt = props.getOptimizer();
    if (!opt.isEnabled()) {
      return OptimizerResolver.NONE;
    }
    Duration processTimeout = opt.getProcessTimeout() != null
        ? opt.getProcessTimeout() : opt.getTimeout();
    ScriptOptimizerResolver.Builder builder = ScriptOptimizerResolver.builder()
        .command(opt.getCommand())
        .processTimeout(processTimeout);
    if (opt.getWorkingDirectory() != null && !opt.getWorkingDirectory().isBlank()) {
      builder.workingDirectory(Path.of(opt.getWorkingDirectory()));
    }
    for (Map.Entry<String, String> script : opt.getScripts().entrySet()) {
      builder.defaultScript(Stage.fromCode(script.getKey()), script.getValue());
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public StageScheduler stageScheduler(StageQueueProperties props,
      ConnectionProvider connectionProvider,
      JdbcStageStores stageStores,
      OptimizerResolver optimizerResolver,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<SimClock> clockProvider,
      ObjectProvider<ReleaseInterceptor> interceptorProvider) {
    StageScheduler.Builder builder = stageStores.applyTo(StageScheduler.builder())
        .connectionProvider(connectionProvider)
        .optimizerResolver(optimizerResolver)
        .optimizerTimeout(props.getOptimizer().getTimeout());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    SimClock clock = clockProvider.getIfAvailable();
    if (clock != null) {
      builder.clock(clock);
    }
    interceptorProvider.orderedStream().forEach(builder::interceptor);
    return builder.build();
  }
}
