package stagequeue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import stagequeue.model.Stage;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void enqueueCountersAreTaggedByStage() {
    exporter.incrementEnqueued(Stage.PRE_ACCEPTANCE);
    exporter.incrementEnqueued(Stage.PRE_ACCEPTANCE);
    exporter.incrementEnqueued(Stage.POST_INSPECTION);
    exporter.incrementEnqueueSkipped(Stage.PRE_INSPECTION);

    assertEquals(2.0, counter("stagequeue.enqueue", "PAP").count());
    assertEquals(1.0, counter("stagequeue.enqueue", "PIPO").count());
    assertEquals(0.0, counter("stagequeue.enqueue", "PIP").count());
    assertEquals(1.0, counter("stagequeue.enqueue.skipped", "PIP").count());
  }

  @Test
  void releasedCountsEntries() {
    exporter.incrementReleased(Stage.PRE_INSPECTION, 4);
    exporter.incrementReleased(Stage.PRE_INSPECTION, 3);

    assertEquals(7.0, counter("stagequeue.release", "PIP").count());
  }

  @Test
  void failureCounters() {
    exporter.incrementOptimizerFailure(Stage.PRE_ACCEPTANCE);
    exporter.incrementEtaWriteFailure(Stage.PRE_ACCEPTANCE);
    exporter.incrementPersistenceFailure(Stage.PRE_ACCEPTANCE);
    exporter.incrementStaleResultDiscarded(Stage.PRE_ACCEPTANCE);

    assertEquals(1.0, counter("stagequeue.optimizer.failure", "PAP").count());
    assertEquals(1.0, counter("stagequeue.eta.write.failure", "PAP").count());
    assertEquals(1.0, counter("stagequeue.release.persistence.failure", "PAP").count());
    assertEquals(1.0, counter("stagequeue.optimizer.stale", "PAP").count());
  }

  @Test
  void recordQueueDepth() {
    exporter.recordQueueDepth(Stage.PRE_INSPECTION, 12, 3);
    assertEquals(12.0, gauge("stagequeue.queue.pending", "PIP").value());
    assertEquals(3.0, gauge("stagequeue.queue.held", "PIP").value());
    assertEquals(0.0, gauge("stagequeue.queue.pending", "PAP").value());

    exporter.recordQueueDepth(Stage.PRE_INSPECTION, 0, 0);
    assertEquals(0.0, gauge("stagequeue.queue.pending", "PIP").value());
  }

  @Test
  void optimizerDuration() {
    exporter.recordOptimizerDurationMs(Stage.POST_INSPECTION, 150);
    exporter.recordOptimizerDurationMs(Stage.POST_INSPECTION, 250);

    var summary = registry.find("stagequeue.optimizer.duration.ms").tag("stage", "PIPO").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(400.0, summary.totalAmount());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "plant1.stagequeue");
    custom.incrementEnqueued(Stage.PRE_ACCEPTANCE);
    custom.recordQueueDepth(Stage.PRE_ACCEPTANCE, 5, 1);

    assertEquals(1.0, counter("plant1.stagequeue.enqueue", "PAP").count());
    assertEquals(5.0, gauge("plant1.stagequeue.queue.pending", "PAP").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.close();
    exporter.incrementEnqueued(Stage.PRE_ACCEPTANCE);

    assertNull(registry.find("stagequeue.enqueue").counter());
    assertNull(registry.find("stagequeue.queue.pending").gauge());
  }

  @Test
  void invalidArgumentsThrow() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class,
        () -> new MicrometerMetricsExporter(registry, "stagequeue."));
  }

  private Counter counter(String name, String stage) {
    Counter c = registry.find(name).tag("stage", stage).counter();
    assertNotNull(c, "Counter not found: " + name + " stage=" + stage);
    return c;
  }

  private Gauge gauge(String name, String stage) {
    Gauge g = registry.find(name).tag("stage", stage).gauge();
    assertNotNull(g, "Gauge not found: " + name + " stage=" + stage);
    return g;
  }
}
