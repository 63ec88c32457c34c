package stagequeue.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import stagequeue.micrometer.MicrometerMetricsExporter;
import stagequeue.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code stagequeue.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link StageQueueAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the scheduler.
 */
@AutoConfiguration(before = StageQueueAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "stagequeue.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(StageQueueProperties.class)
public class StageQueueMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, StageQueueProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
