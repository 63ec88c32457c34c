package stagequeue.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import stagequeue.micrometer.MicrometerMetricsExporter;
import stagequeue.spi.MetricsExporter;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageQueueMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(StageQueueMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void createsMicrometerExporterByDefault() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void respectsCustomNamePrefix() {
    runner.withPropertyValues("stagequeue.metrics.name-prefix=plant1.sq").run(ctx -> {
      var registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("plant1.sq.enqueue").tag("stage", "PAP").counter());
    });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withPropertyValues("stagequeue.metrics.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
    });
  }

  @Test
  void backsOffWhenCustomMetricsExporterPresent() {
    runner.withBean(MetricsExporter.class, () -> MetricsExporter.NOOP).run(ctx -> {
      assertSame(MetricsExporter.NOOP, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void backsOffWithoutMeterRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(StageQueueMicrometerAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }
}
