package stagequeue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import stagequeue.model.Stage;
import stagequeue.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Every meter carries a {@code stage} tag ({@code PAP}, {@code PIP}, {@code PIPO}).
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code stagequeue.enqueue}: entries added to a queue</li>
 *   <li>{@code stagequeue.enqueue.skipped}: enqueues of an already pending order</li>
 *   <li>{@code stagequeue.release}: entries released</li>
 *   <li>{@code stagequeue.release.persistence.failure}: release transactions rolled back</li>
 *   <li>{@code stagequeue.optimizer.failure}: optimizer calls that fell back to FIFO</li>
 *   <li>{@code stagequeue.optimizer.stale}: optimizer results discarded after a window change</li>
 *   <li>{@code stagequeue.eta.write.failure}: delivery-date writes that failed</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code stagequeue.queue.pending}: pending entries after the last release cycle</li>
 *   <li>{@code stagequeue.queue.held}: entries on hold after the last release cycle</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code stagequeue.optimizer.duration.ms}: optimizer call time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_PREFIX = "stagequeue";

  private final MeterRegistry registry;
  private final Map<Stage, StageMeters> meters = new EnumMap<>(Stage.class);
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * @param namePrefix prefix for all meter names (e.g. {@code "plant1.stagequeue"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    for (Stage stage : Stage.values()) {
      meters.put(stage, new StageMeters(registry, namePrefix, stage.code()));
    }
  }

  @Override
  public void incrementEnqueued(Stage stage) {
    if (closed) return;
    meters.get(stage).enqueued.increment();
  }

  @Override
  public void incrementEnqueueSkipped(Stage stage) {
    if (closed) return;
    meters.get(stage).enqueueSkipped.increment();
  }

  @Override
  public void incrementReleased(Stage stage, int count) {
    if (closed) return;
    meters.get(stage).released.increment(count);
  }

  @Override
  public void incrementOptimizerFailure(Stage stage) {
    if (closed) return;
    meters.get(stage).optimizerFailure.increment();
  }

  @Override
  public void incrementEtaWriteFailure(Stage stage) {
    if (closed) return;
    meters.get(stage).etaWriteFailure.increment();
  }

  @Override
  public void incrementPersistenceFailure(Stage stage) {
    if (closed) return;
    meters.get(stage).persistenceFailure.increment();
  }

  @Override
  public void incrementStaleResultDiscarded(Stage stage) {
    if (closed) return;
    meters.get(stage).staleDiscarded.increment();
  }

  @Override
  public void recordOptimizerDurationMs(Stage stage, long durationMs) {
    if (closed) return;
    meters.get(stage).optimizerDuration.record(durationMs);
  }

  @Override
  public void recordQueueDepth(Stage stage, int pending, int onHold) {
    if (closed) return;
    StageMeters m = meters.get(stage);
    m.pendingDepth.set(pending);
    m.heldDepth.set(onHold);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (StageMeters m : meters.values()) {
      for (Meter meter : m.all()) {
        try {
          registry.remove(meter);
        } catch (RuntimeException e) {
          if (first == null) first = e;
          else first.addSuppressed(e);
        }
      }
    }
    if (first != null) throw first;
  }

  private static final class StageMeters {
    final Counter enqueued;
    final Counter enqueueSkipped;
    final Counter released;
    final Counter persistenceFailure;
    final Counter optimizerFailure;
    final Counter staleDiscarded;
    final Counter etaWriteFailure;
    final DistributionSummary optimizerDuration;
    final AtomicInteger pendingDepth = new AtomicInteger();
    final AtomicInteger heldDepth = new AtomicInteger();
    final Gauge pendingGauge;
    final Gauge heldGauge;

    StageMeters(MeterRegistry registry, String prefix, String stage) {
      enqueued = counter(registry, prefix + ".enqueue", stage, "Entries added to a stage queue");
      enqueueSkipped = counter(registry, prefix + ".enqueue.skipped", stage,
          "Enqueues of an order already pending in the stage");
      released = counter(registry, prefix + ".release", stage, "Entries released");
      persistenceFailure = counter(registry, prefix + ".release.persistence.failure", stage,
          "Release transactions rolled back");
      optimizerFailure = counter(registry, prefix + ".optimizer.failure", stage,
          "Optimizer calls that fell back to FIFO");
      staleDiscarded = counter(registry, prefix + ".optimizer.stale", stage,
          "Optimizer results discarded after a batch window change");
      etaWriteFailure = counter(registry, prefix + ".eta.write.failure", stage,
          "Delivery-date writes that failed");
      optimizerDuration = DistributionSummary.builder(prefix + ".optimizer.duration.ms")
          .description("Optimizer call time in milliseconds")
          .tag("stage", stage)
          .register(registry);
      pendingGauge = Gauge.builder(prefix + ".queue.pending", pendingDepth, AtomicInteger::get)
          .tag("stage", stage)
          .register(registry);
      heldGauge = Gauge.builder(prefix + ".queue.held", heldDepth, AtomicInteger::get)
          .tag("stage", stage)
          .register(registry);
    }

    private static Counter counter(MeterRegistry registry, String name, String stage,
        String description) {
      return Counter.builder(name).description(description).tag("stage", stage).register(registry);
    }

    List<Meter> all() {
      List<Meter> all = new ArrayList<>(List.of(enqueued, enqueueSkipped, released,
          persistenceFailure, optimizerFailure, staleDiscarded, etaWriteFailure));
      all.add(optimizerDuration);
      all.add(pendingGauge);
      all.add(heldGauge);
      return all;
    }
  }
}
