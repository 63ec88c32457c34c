package stagequeue.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageQueuePropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(StageQueueProperties.class);
      assertEquals("sq_", props.getTablePrefix());
      assertTrue(props.getOptimizer().isEnabled());
      assertEquals(Duration.ofSeconds(30), props.getOptimizer().getTimeout());
      assertNull(props.getOptimizer().getProcessTimeout());
      assertEquals(List.of("python3"), props.getOptimizer().getCommand());
      assertNull(props.getOptimizer().getWorkingDirectory());
      assertTrue(props.getOptimizer().getScripts().isEmpty());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("stagequeue", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "stagequeue.table-prefix=plant_",
        "stagequeue.optimizer.enabled=false",
        "stagequeue.optimizer.timeout=5s",
        "stagequeue.optimizer.process-timeout=10s",
        "stagequeue.optimizer.command=python3.11,-u",
        "stagequeue.optimizer.working-directory=/opt/scheduling",
        "stagequeue.optimizer.scripts.pip=python/pip.py",
        "stagequeue.metrics.enabled=false",
        "stagequeue.metrics.name-prefix=plant1.sq"
    ).run(ctx -> {
      var props = ctx.getBean(StageQueueProperties.class);
      assertEquals("plant_", props.getTablePrefix());
      assertFalse(props.getOptimizer().isEnabled());
      assertEquals(Duration.ofSeconds(5), props.getOptimizer().getTimeout());
      assertEquals(Duration.ofSeconds(10), props.getOptimizer().getProcessTimeout());
      assertEquals(List.of("python3.11", "-u"), props.getOptimizer().getCommand());
      assertEquals("/opt/scheduling", props.getOptimizer().getWorkingDirectory());
      assertEquals(Map.of("pip", "python/pip.py"), props.getOptimizer().getScripts());
      assertFalse(props.getMetrics().isEnabled());
      assertEquals("plant1.sq", props.getMetrics().getNamePrefix());
    });
  }

  @Configuration
  @EnableConfigurationProperties(StageQueueProperties.class)
  static class PropsConfig {
  }
}
