package stagequeue.release;

import com.github.f4b6a3.ulid.UlidCreator;
import stagequeue.SimClock;
import stagequeue.model.DeliveryDateRecord;
import stagequeue.model.Stage;
import stagequeue.optimizer.OptimizerResult.EtaPrediction;
import stagequeue.spi.DeliveryDateStore;
import stagequeue.spi.MetricsExporter;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes optimizer ETAs to the delivery-date store, one order at a time.
 *
 * <p>Writes are best effort: a failure for one order is logged and counted, and the
 * remaining orders are still written. The connection should be in auto-commit mode so
 * each order's supersede-and-insert stands on its own.
 */
public final class DeliveryDatePropagator {
  private static final Logger logger = Logger.getLogger(DeliveryDatePropagator.class.getName());

  private final DeliveryDateStore deliveryDateStore;
  private final SimClock clock;
  private final MetricsExporter metrics;

  public DeliveryDatePropagator(DeliveryDateStore deliveryDateStore, SimClock clock,
      MetricsExporter metrics) {
    this.deliveryDateStore = Objects.requireNonNull(deliveryDateStore, "deliveryDateStore");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Writes one current delivery-date record per usable ETA. ETAs for unknown orders,
   * non-finite or non-positive values, and repeated ids after the first are skipped.
   *
   * @param etaList      ETAs in sim-minutes from {@code nowSimMinute}; may be {@code null}
   * @param knownOrderIds orders present in the local pool
   * @param optimizer    identity recorded on each record
   */
  public EtaWriteSummary propagate(Connection conn, Stage stage, List<EtaPrediction> etaList,
      Set<String> knownOrderIds, long nowSimMinute, String optimizer) {
    if (etaList == null || etaList.isEmpty()) {
      return EtaWriteSummary.NONE;
    }
    List<String> written = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    int failed = 0;
    for (EtaPrediction eta : etaList) {
      if (!eta.isUsable() || !knownOrderIds.contains(eta.orderId()) || !seen.add(eta.orderId())) {
        continue;
      }
      long etaSimMinute = nowSimMinute + Math.round(eta.eta());
      Instant createdAt = clock.wallClockNow();
      DeliveryDateRecord record = new DeliveryDateRecord(
          UlidCreator.getMonotonicUlid().toString(),
          eta.orderId(),
          stage,
          etaSimMinute,
          clock.calendarAt(etaSimMinute),
          optimizer,
          true,
          createdAt);
      try {
        deliveryDateStore.supersedeAndInsert(conn, record);
        written.add(eta.orderId());
      } catch (RuntimeException e) {
        failed++;
        metrics.incrementEtaWriteFailure(stage);
        logger.log(Level.WARNING, "Failed to write delivery date for order " + eta.orderId()
            + " in " + stage.code(), e);
      }
    }
    return new EtaWriteSummary(written, failed);
  }
}
