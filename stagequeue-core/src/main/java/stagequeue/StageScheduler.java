package stagequeue;

import com.github.f4b6a3.ulid.UlidCreator;
import stagequeue.StageResult.ErrorKind;
import stagequeue.batch.BatchWindowController;
import stagequeue.batch.StageLocks;
import stagequeue.batch.WindowCheck;
import stagequeue.hold.HoldBatchOutcome;
import stagequeue.hold.HoldItemResult;
import stagequeue.hold.HoldPartition;
import stagequeue.hold.HoldRegistry;
import stagequeue.hold.HoldRequest;
import stagequeue.log.SchedulingLog;
import stagequeue.model.LogMode;
import stagequeue.model.OrderInfo;
import stagequeue.model.QueueEntry;
import stagequeue.model.SchedulingLogEntry;
import stagequeue.model.Stage;
import stagequeue.model.StageConfig;
import stagequeue.optimizer.Optimizer;
import stagequeue.optimizer.OptimizerBridge;
import stagequeue.optimizer.OptimizerOrder;
import stagequeue.optimizer.OptimizerOutcome;
import stagequeue.optimizer.OptimizerRequest;
import stagequeue.optimizer.OptimizerResolver;
import stagequeue.optimizer.OptimizerResult;
import stagequeue.release.DeliveryDatePropagator;
import stagequeue.release.EtaWriteSummary;
import stagequeue.release.ReconcileResult;
import stagequeue.release.ReleaseReconciler;
import stagequeue.spi.ConnectionProvider;
import stagequeue.spi.DeliveryDateStore;
import stagequeue.spi.DispatchOrderStore;
import stagequeue.spi.MetricsExporter;
import stagequeue.spi.OrderDirectory;
import stagequeue.spi.QueueStore;
import stagequeue.spi.SchedulingLogStore;
import stagequeue.spi.StageConfigRepository;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the three-stage queue, batch, hold and release pipeline.
 *
 * <p>The scheduler is driven by a caller that advances simulation time and, once per stage
 * per tick, calls {@link #checkAndReleaseBatch}. It starts no threads of its own apart from
 * the optimizer worker pool used to bound optimizer calls by a timeout.
 *
 * <p>Every public operation returns a {@link StageResult}; none throws. Mutations that affect
 * release eligibility run under a per-{@code (factory, stage)} lock; the release write
 * ({@code releasedAt} plus dispatch sequence plus window close) is a single transaction.
 *
 * <pre>{@code
 * JdbcStageStores stores = JdbcStageStores.create(TableNames.DEFAULT_PREFIX);
 * try (StageScheduler scheduler = stores.applyTo(StageScheduler.builder())
 *     .connectionProvider(dataSource::getConnection)
 *     .optimizerResolver(new ScriptOptimizerResolver())
 *     .build()) {
 *   scheduler.enqueue(Stage.PRE_ACCEPTANCE, "order-1", 0);
 *   scheduler.checkAndReleaseBatch(Stage.PRE_ACCEPTANCE, 30, "factory-1");
 * }
 * }</pre>
 *
 * @see Builder
 */
public final class StageScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(StageScheduler.class.getName());

  /** Lock key shared by all factories; guards {@code processingOrder} assignment. */
  private static final String STAGE_SEQUENCE = "*";

  private final ConnectionProvider connectionProvider;
  private final QueueStore queueStore;
  private final StageConfigRepository configRepository;
  private final OrderDirectory orderDirectory;
  private final DispatchOrderStore dispatchOrderStore;
  private final OptimizerResolver optimizerResolver;
  private final OptimizerBridge optimizerBridge;
  private final MetricsExporter metrics;
  private final List<ReleaseInterceptor> interceptors;
  private final Map<String, Object> optimizerSettings;

  private final StageLocks locks = new StageLocks();
  private final HoldRegistry holdRegistry;
  private final BatchWindowController windowController;
  private final ReleaseReconciler reconciler;
  private final DeliveryDatePropagator propagator;
  private final SchedulingLog schedulingLog;

  private StageScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(builder.queueStore, "queueStore");
    this.configRepository = Objects.requireNonNull(builder.configRepository, "configRepository");
    this.orderDirectory = Objects.requireNonNull(builder.orderDirectory, "orderDirectory");
    this.dispatchOrderStore = Objects.requireNonNull(builder.dispatchOrderStore, "dispatchOrderStore");
    DeliveryDateStore deliveryDateStore =
        Objects.requireNonNull(builder.deliveryDateStore, "deliveryDateStore");
    SchedulingLogStore schedulingLogStore =
        Objects.requireNonNull(builder.schedulingLogStore, "schedulingLogStore");
    this.optimizerResolver = builder.optimizerResolver != null
        ? builder.optimizerResolver : OptimizerResolver.NONE;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    SimClock clock = builder.clock != null ? builder.clock : SimClock.UNANCHORED;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.optimizerSettings = Collections.unmodifiableMap(new LinkedHashMap<>(
        builder.optimizerSettings != null ? builder.optimizerSettings : OptimizerRequest.DEFAULT_SETTINGS));

    this.optimizerBridge = OptimizerBridge.builder()
        .timeout(builder.optimizerTimeout)
        .metrics(metrics)
        .build();
    this.holdRegistry = new HoldRegistry(queueStore);
    this.windowController = new BatchWindowController(configRepository);
    this.reconciler = new ReleaseReconciler(queueStore, dispatchOrderStore, windowController);
    this.propagator = new DeliveryDatePropagator(deliveryDateStore, clock, metrics);
    this.schedulingLog = new SchedulingLog(connectionProvider, schedulingLogStore, clock);
  }

  public static Builder builder() {
    return new Builder();
  }

  // ---------------------------------------------------------------------------------------
  // Queue

  /**
   * Enqueues an order without optimizer payload.
   *
   * @see #enqueue(Stage, String, long, String, String)
   */
  public StageResult<EnqueueOutcome> enqueue(Stage stage, String orderId, long simMinute) {
    return enqueue(stage, orderId, simMinute, null, null);
  }

  /**
   * Adds an order to a stage queue.
   *
   * <p>If the order is already pending in the stage the call is skipped. A released entry
   * for the same order is deleted and replaced by a fresh pending one. The first enqueue
   * into a batching stage with a closed window opens the window at {@code simMinute}.
   *
   * @param possibleSequence opaque optimizer payload, may be {@code null}
   * @param processTimes     opaque optimizer payload, may be {@code null}
   * @return {@code NOT_FOUND} if the order does not exist
   */
  public StageResult<EnqueueOutcome> enqueue(Stage stage, String orderId, long simMinute,
      String possibleSequence, String processTimes) {
    if (stage == null || orderId == null || orderId.isBlank()) {
      return invalid("stage and orderId are required");
    }
    return run("enqueue " + orderId + " into " + stage.code(), conn -> {
      Optional<OrderInfo> order = orderDirectory.findOrder(conn, orderId);
      if (order.isEmpty()) {
        return StageResult.failure(ErrorKind.NOT_FOUND, "Order not found: " + orderId);
      }
      String factoryId = order.get().factoryId();
      return locks.withLock(factoryId, stage, () -> StageResult.success(
          doEnqueue(conn, factoryId, stage, orderId, simMinute, possibleSequence, processTimes)));
    });
  }

  private EnqueueOutcome doEnqueue(Connection conn, String factoryId, Stage stage, String orderId,
      long simMinute, String possibleSequence, String processTimes) {
    StageConfig config = windowController.getOrCreate(conn, factoryId, stage);
    Optional<QueueEntry> existing = queueStore.find(conn, stage, orderId);
    if (existing.isPresent() && existing.get().isPending()) {
      metrics.incrementEnqueueSkipped(stage);
      return new EnqueueOutcome(existing.get(), true);
    }

    QueueEntry inserted = locks.withLock(STAGE_SEQUENCE, stage, () -> {
      // read the max while the retired entry still counts towards it
      long processingOrder = queueStore.maxProcessingOrder(conn, stage) + 1;
      if (existing.isPresent()) {
        queueStore.delete(conn, existing.get().id());
      }
      QueueEntry entry = new QueueEntry(UlidCreator.getMonotonicUlid().toString(), factoryId,
          orderId, stage, possibleSequence, processTimes, processingOrder, simMinute,
          config.releaseAfterMinutes(), null, null, null, null, 0);
      return queueStore.insert(conn, entry) ? entry : null;
    });
    if (inserted == null) {
      // lost a race against another writer for the same order
      metrics.incrementEnqueueSkipped(stage);
      return new EnqueueOutcome(queueStore.find(conn, stage, orderId).orElse(null), true);
    }

    windowController.openIfClosed(conn, config, simMinute);
    metrics.incrementEnqueued(stage);
    for (ReleaseInterceptor interceptor : interceptors) {
      try {
        interceptor.afterEnqueue(inserted);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Interceptor afterEnqueue failed for order " + orderId, e);
      }
    }
    return new EnqueueOutcome(inserted, false);
  }

  /**
   * Releases the head of a stage queue if it is individually due
   * ({@code now >= queuedAt + releaseAfter}), regardless of batch windows.
   *
   * <p>Entries on hold are skipped; expired holds are cleared on the way. When the
   * release empties the factory's queue, its batch window is closed.
   */
  public StageResult<ReleaseOutcome> releaseNext(Stage stage, long simMinute) {
    if (stage == null) {
      return invalid("stage is required");
    }
    return run("release next from " + stage.code(), conn -> {
      QueueEntry head = null;
      for (QueueEntry entry : queueStore.listPending(conn, stage)) {
        if (!entry.isOnHold(simMinute)) {
          head = entry;
          break;
        }
      }
      if (head == null) {
        return StageResult.success(ReleaseOutcome.nothing("No releasable orders in " + stage.code()));
      }
      if (simMinute < head.releaseAtSimMinute()) {
        return StageResult.success(ReleaseOutcome.waiting(head, head.waitMinutes(simMinute)));
      }
      QueueEntry candidate = head;
      return locks.withLock(candidate.factoryId(), stage,
          () -> StageResult.success(releaseSingle(conn, candidate, simMinute)));
    });
  }

  private ReleaseOutcome releaseSingle(Connection conn, QueueEntry candidate, long simMinute) {
    Stage stage = candidate.stage();
    // the head was picked without the lock; a hold or release may have landed since
    Optional<QueueEntry> current = queueStore.find(conn, stage, candidate.orderId());
    if (current.isEmpty() || !current.get().isPending()
        || !current.get().id().equals(candidate.id())) {
      return ReleaseOutcome.nothing("Order " + candidate.orderId() + " is no longer pending");
    }
    QueueEntry entry = current.get();
    if (entry.isOnHold(simMinute)) {
      return ReleaseOutcome.nothing("Order " + entry.orderId() + " was put on hold");
    }
    if (simMinute < entry.releaseAtSimMinute()) {
      return ReleaseOutcome.waiting(entry, entry.waitMinutes(simMinute));
    }
    if (entry.isHoldExpired(simMinute)) {
      holdRegistry.clearHold(conn, stage, entry.orderId());
    }
    if (queueStore.markReleased(conn, stage, List.of(entry.orderId()), simMinute) == 0) {
      return ReleaseOutcome.nothing("Order " + entry.orderId() + " is no longer pending");
    }
    if (queueStore.listPending(conn, entry.factoryId(), stage).isEmpty()) {
      windowController.close(conn, entry.factoryId(), stage);
    }
    metrics.incrementReleased(stage, 1);
    QueueEntry released = queueStore.find(conn, stage, entry.orderId()).orElse(entry);
    notifyReleased(entry.factoryId(), stage, new BatchReleaseOutcome(true, false, 0,
        List.of(entry.orderId()), 0, 0, false, 0, 0, 0, 0, "Released order " + entry.orderId()));
    return ReleaseOutcome.released(released);
  }

  /**
   * Status of a stage queue across all factories.
   */
  public StageResult<QueueStatus> status(Stage stage, long simMinute) {
    if (stage == null) {
      return invalid("stage is required");
    }
    return run("read " + stage.code() + " status",
        conn -> StageResult.success(toStatus(stage, simMinute, queueStore.listPending(conn, stage))));
  }

  /**
   * Status of one factory's stage queue.
   */
  public StageResult<QueueStatus> status(Stage stage, long simMinute, String factoryId) {
    if (stage == null || factoryId == null) {
      return invalid("stage and factoryId are required");
    }
    return run("read " + stage.code() + " status", conn -> StageResult.success(
        toStatus(stage, simMinute, queueStore.listPending(conn, factoryId, stage))));
  }

  private static QueueStatus toStatus(Stage stage, long simMinute, List<QueueEntry> pending) {
    List<QueueStatus.EntryStatus> entries = new ArrayList<>(pending.size());
    int ready = 0;
    int onHold = 0;
    for (QueueEntry entry : pending) {
      long wait = entry.waitMinutes(simMinute);
      boolean held = entry.isOnHold(simMinute);
      boolean isReady = wait == 0 && !held;
      if (isReady) {
        ready++;
      }
      if (held) {
        onHold++;
      }
      entries.add(new QueueStatus.EntryStatus(entry, entry.state(simMinute), isReady, wait,
          entry.releaseAtSimMinute()));
    }
    return new QueueStatus(stage, simMinute, pending.size(), ready, onHold, entries);
  }

  /**
   * Deletes released entries of a stage; pending entries are untouched.
   *
   * @return the number of entries deleted
   */
  public StageResult<Integer> clearReleased(Stage stage) {
    if (stage == null) {
      return invalid("stage is required");
    }
    return run("clear released " + stage.code() + " entries",
        conn -> StageResult.success(queueStore.deleteReleased(conn, stage)));
  }

  /**
   * Deletes every queue entry of every stage and closes every batch window.
   *
   * @return the number of entries deleted
   */
  public StageResult<Integer> clearAll() {
    return run("clear all queues", conn -> inTransaction(conn, () -> {
      int deleted = queueStore.deleteAll(conn);
      configRepository.closeAllWindows(conn);
      logger.info("Cleared all stage queues (" + deleted + " entries)");
      return StageResult.success(deleted);
    }));
  }

  // ---------------------------------------------------------------------------------------
  // Holds

  /**
   * Holds a pending order until {@code holdUntilSimMinute}, overwriting any previous hold.
   *
   * @return the updated entry; {@code NOT_FOUND} if the order is not pending in the stage
   */
  public StageResult<QueueEntry> setHold(Stage stage, String orderId, long holdUntilSimMinute,
      String reason, long simMinute) {
    if (stage == null || orderId == null) {
      return invalid("stage and orderId are required");
    }
    if (reason == null || reason.isBlank()) {
      return invalid("reason is required");
    }
    return run("hold " + orderId + " in " + stage.code(), conn -> {
      Optional<QueueEntry> entry = findPending(conn, stage, orderId);
      if (entry.isEmpty()) {
        return notPending(stage, orderId);
      }
      return locks.withLock(entry.get().factoryId(), stage, () -> {
        if (!holdRegistry.setHold(conn, stage, orderId, holdUntilSimMinute, reason, simMinute)) {
          return notPending(stage, orderId);
        }
        return StageResult.success(queueStore.find(conn, stage, orderId).orElseThrow());
      });
    });
  }

  /**
   * Clears the hold of a pending order. {@code holdCount} is kept.
   *
   * @return the updated entry; {@code NOT_FOUND} if the order is not pending in the stage
   */
  public StageResult<QueueEntry> clearHold(Stage stage, String orderId) {
    if (stage == null || orderId == null) {
      return invalid("stage and orderId are required");
    }
    return run("clear hold of " + orderId + " in " + stage.code(), conn -> {
      Optional<QueueEntry> entry = findPending(conn, stage, orderId);
      if (entry.isEmpty()) {
        return notPending(stage, orderId);
      }
      return locks.withLock(entry.get().factoryId(), stage, () -> {
        holdRegistry.clearHold(conn, stage, orderId);
        return StageResult.success(queueStore.find(conn, stage, orderId).orElseThrow());
      });
    });
  }

  /**
   * Applies several holds independently; one failing item does not stop the others.
   */
  public StageResult<HoldBatchOutcome> setMultipleHolds(Stage stage, List<HoldRequest> holds,
      long simMinute) {
    if (stage == null || holds == null) {
      return invalid("stage and holds are required");
    }
    return run("set " + holds.size() + " holds in " + stage.code(), conn -> {
      Map<String, String> factoryByOrder = new HashMap<>();
      for (QueueEntry entry : queueStore.listPending(conn, stage)) {
        factoryByOrder.put(entry.orderId(), entry.factoryId());
      }
      List<HoldItemResult> items = new ArrayList<>(holds.size());
      int applied = 0;
      for (HoldRequest request : holds) {
        String factoryId = factoryByOrder.get(request.orderId());
        if (factoryId == null) {
          items.add(HoldItemResult.failed(request.orderId(), "order not pending in " + stage.code()));
          continue;
        }
        HoldBatchOutcome one = locks.withLock(factoryId, stage,
            () -> holdRegistry.setMultiple(conn, stage, List.of(request), simMinute));
        items.addAll(one.items());
        applied += one.applied();
      }
      return StageResult.success(new HoldBatchOutcome(applied, items));
    });
  }

  // ---------------------------------------------------------------------------------------
  // Config

  /**
   * Returns the config of every stage of a factory, creating immediate-release defaults
   * for stages that have none.
   */
  public StageResult<FactoryQueueConfig> getConfig(String factoryId) {
    if (factoryId == null) {
      return invalid("factoryId is required");
    }
    return run("read config of factory " + factoryId, conn -> {
      if (!orderDirectory.factoryExists(conn, factoryId)) {
        return StageResult.failure(ErrorKind.NOT_FOUND, "Factory not found: " + factoryId);
      }
      return StageResult.success(readConfig(conn, factoryId));
    });
  }

  private FactoryQueueConfig readConfig(Connection conn, String factoryId) {
    Map<Stage, StageConfig> stages = new EnumMap<>(Stage.class);
    for (Stage stage : Stage.values()) {
      stages.put(stage, windowController.getOrCreate(conn, factoryId, stage));
    }
    return new FactoryQueueConfig(factoryId, stages);
  }

  /**
   * Updates release settings. An open batch window is left as is; a window left open by a
   * change to immediate release is cleared at the next release.
   *
   * @return the config after the update
   */
  public StageResult<FactoryQueueConfig> updateConfig(String factoryId, ConfigUpdate update) {
    if (factoryId == null || update == null) {
      return invalid("factoryId and update are required");
    }
    for (Map.Entry<Stage, Integer> entry : update.releaseAfterMinutes().entrySet()) {
      if (entry.getValue() < 0) {
        return invalid("releaseAfterMinutes for " + entry.getKey().code() + " must be >= 0");
      }
    }
    return run("update config of factory " + factoryId, conn -> {
      if (!orderDirectory.factoryExists(conn, factoryId)) {
        return StageResult.failure(ErrorKind.NOT_FOUND, "Factory not found: " + factoryId);
      }
      for (Stage stage : Stage.values()) {
        if (!update.touches(stage)) {
          continue;
        }
        locks.withLock(factoryId, stage, () -> {
          StageConfig current = windowController.getOrCreate(conn, factoryId, stage);
          int minutes = update.releaseAfterMinutes()
              .getOrDefault(stage, current.releaseAfterMinutes());
          String script = update.optimizerScripts().containsKey(stage)
              ? blankToNull(update.optimizerScripts().get(stage))
              : current.optimizerScript();
          configRepository.saveSettings(conn, factoryId, stage, minutes, script);
          return null;
        });
      }
      return StageResult.success(readConfig(conn, factoryId));
    });
  }

  // ---------------------------------------------------------------------------------------
  // Release cycle

  /**
   * Runs one release cycle for a factory's stage.
   *
   * <ol>
   *   <li>Empty queue: an open window is closed, nothing is released.</li>
   *   <li>Not due (window immature or no window): reports waiting / no active batch.</li>
   *   <li>Due: expired holds are cleared, the optimizer is called once, its hold decisions
   *       are applied, the pool is reconciled, and every entry not on hold is released in
   *       one transaction together with the dispatch sequence and the window close.</li>
   *   <li>ETAs are written best effort and a summary is appended to the scheduling log.</li>
   * </ol>
   *
   * <p>If entries on hold stay behind in a batching stage, a new window opens at
   * {@code simMinute}. If every pending entry is on hold, nothing is released and the
   * window stays open.
   *
   * @return {@code NOT_FOUND} if the factory has no config for the stage;
   *     {@code PERSISTENCE} if the release transaction failed and was rolled back
   */
  public StageResult<BatchReleaseOutcome> checkAndReleaseBatch(Stage stage, long simMinute,
      String factoryId) {
    if (stage == null || factoryId == null) {
      return invalid("stage and factoryId are required");
    }
    return run("check and release " + stage.code() + " batch for factory " + factoryId,
        conn -> locks.withLock(factoryId, stage,
            () -> releaseCycle(conn, factoryId, stage, simMinute)));
  }

  private StageResult<BatchReleaseOutcome> releaseCycle(Connection conn, String factoryId,
      Stage stage, long simMinute) throws SQLException {
    Optional<StageConfig> found = configRepository.find(conn, factoryId, stage);
    if (found.isEmpty()) {
      return StageResult.failure(ErrorKind.NOT_FOUND,
          "Queue config not found for factory " + factoryId + " stage " + stage.code());
    }
    StageConfig config = found.get();

    List<QueueEntry> pending = queueStore.listPending(conn, factoryId, stage);
    if (pending.isEmpty()) {
      boolean closed = config.isWindowOpen() && windowController.close(conn, factoryId, stage);
      return StageResult.success(BatchReleaseOutcome.notReleased(0, 0,
          closed ? "No orders in batch; window closed" : "No orders in queue"));
    }

    WindowCheck check = windowController.checkDue(config, simMinute);
    if (!check.due()) {
      return StageResult.success(check.windowOpen()
          ? BatchReleaseOutcome.waiting(check.waitMinutes())
          : BatchReleaseOutcome.notReleased(0, 0, check.message()));
    }

    HoldPartition partition = holdRegistry.partition(conn, stage, pending, simMinute);

    Optimizer optimizer = optimizerResolver.resolve(factoryId, stage, config);
    OptimizerOutcome optimized = optimize(conn, factoryId, stage, config, partition.pending(),
        simMinute, optimizer);
    if (windowChanged(conn, factoryId, stage, config)) {
      return StageResult.success(BatchReleaseOutcome.notReleased(0, partition.clearedCount(),
          "Batch window changed during optimization; result discarded"));
    }
    OptimizerResult result = optimized.result();
    if (result != null && !holdRegistry.applyDecisions(conn, stage, result.holdDecisions(),
        orderIds(partition.pending()), simMinute).isEmpty()) {
      partition = partition.withPending(queueStore.listPending(conn, factoryId, stage));
    }
    List<QueueEntry> pool = partition.pending();

    ReconcileResult reconciled = reconciler.reconcile(pool, result);
    Set<String> heldIds = partition.heldOrderIds(simMinute);
    List<String> releaseIds = reconciled.orderIdsExcluding(heldIds);
    if (releaseIds.isEmpty()) {
      metrics.recordQueueDepth(stage, pool.size(), heldIds.size());
      return StageResult.success(BatchReleaseOutcome.notReleased(heldIds.size(),
          partition.clearedCount(), "All " + pool.size() + " pending orders are on hold"));
    }

    List<String> dispatchIds = new ArrayList<>(releaseIds);
    if (stage == Stage.PRE_ACCEPTANCE) {
      for (String id : reconciled.orderIds()) {
        if (heldIds.contains(id)) {
          dispatchIds.add(id);
        }
      }
    }
    boolean reopen = !heldIds.isEmpty() && !config.isImmediate();

    int released;
    try {
      released = inTransaction(conn, () -> reconciler.commit(conn, factoryId, stage, releaseIds,
          dispatchIds, simMinute, reopen));
    } catch (SQLException | RuntimeException e) {
      metrics.incrementPersistenceFailure(stage);
      logger.log(Level.SEVERE, "Release of " + releaseIds.size() + " " + stage.code()
          + " orders for factory " + factoryId + " rolled back", e);
      return StageResult.failure(ErrorKind.PERSISTENCE, "Release failed: " + describe(e));
    }

    EtaWriteSummary etas = result == null ? EtaWriteSummary.NONE
        : propagator.propagate(conn, stage, result.etaList(), orderIds(pool), simMinute,
            optimized.optimizer());

    BatchReleaseOutcome outcome = new BatchReleaseOutcome(true, false, 0, releaseIds,
        heldIds.size(), partition.clearedCount(), reconciled.ranked(), reconciled.reorderCount(),
        reconciled.diffCount(), etas.written(), etas.failed(),
        "Released " + released + " orders" + (heldIds.isEmpty() ? "" : ", " + heldIds.size() + " on hold"));

    metrics.incrementReleased(stage, released);
    metrics.recordQueueDepth(stage, heldIds.size(), heldIds.size());
    schedulingLog.append(factoryId, stage, LogMode.SUMMARY,
        summaryDetails(outcome, optimized, result, simMinute));
    logger.fine(() -> "Released " + releaseIds + " from " + stage.code() + " for factory " + factoryId);
    notifyReleased(factoryId, stage, outcome);
    return StageResult.success(outcome);
  }

  /**
   * Runs the optimizer over a factory's stage queue without releasing anything: applies
   * its hold decisions, rewrites the dispatch sequence of every pending entry in reconciled
   * order, and writes ETAs.
   */
  public StageResult<PlanOutcome> planStage(Stage stage, long simMinute, String factoryId) {
    if (stage == null || factoryId == null) {
      return invalid("stage and factoryId are required");
    }
    return run("plan " + stage.code() + " for factory " + factoryId,
        conn -> locks.withLock(factoryId, stage, () -> {
          StageConfig config = windowController.getOrCreate(conn, factoryId, stage);
          List<QueueEntry> pending = queueStore.listPending(conn, factoryId, stage);
          if (pending.isEmpty()) {
            return StageResult.success(new PlanOutcome(List.of(), false, 0, 0, 0, 0));
          }
          HoldPartition partition = holdRegistry.partition(conn, stage, pending, simMinute);
          List<QueueEntry> pool = partition.pending();
          OptimizerOutcome optimized = optimize(conn, factoryId, stage, config, pool, simMinute,
              optimizerResolver.resolve(factoryId, stage, config));
          if (windowChanged(conn, factoryId, stage, config)) {
            return StageResult.success(new PlanOutcome(List.of(), false, 0, 0, 0, 0));
          }
          OptimizerResult result = optimized.result();
          int holdsApplied = result == null ? 0 : holdRegistry.applyDecisions(conn, stage,
              result.holdDecisions(), orderIds(pool), simMinute).size();

          ReconcileResult reconciled = reconciler.reconcile(pool, result);
          dispatchOrderStore.write(conn, stage, reconciled.orderIds());
          EtaWriteSummary etas = result == null ? EtaWriteSummary.NONE
              : propagator.propagate(conn, stage, result.etaList(), orderIds(pool), simMinute,
                  optimized.optimizer());
          return StageResult.success(new PlanOutcome(reconciled.orderIds(), reconciled.ranked(),
              reconciled.reorderCount(), holdsApplied, etas.written(), etas.failed()));
        }));
  }

  private boolean windowChanged(Connection conn, String factoryId, Stage stage, StageConfig config) {
    Long windowNow = windowController.currentWindowStart(conn, factoryId, stage);
    if (Objects.equals(windowNow, config.batchStartSimMinute())) {
      return false;
    }
    metrics.incrementStaleResultDiscarded(stage);
    logger.log(Level.WARNING, "Batch window of factory " + factoryId + " stage " + stage.code()
        + " changed while optimizing (" + config.batchStartSimMinute() + " -> " + windowNow
        + "); discarding result");
    return true;
  }

  private OptimizerOutcome optimize(Connection conn, String factoryId, Stage stage,
      StageConfig config, List<QueueEntry> pool, long simMinute, Optimizer optimizer) {
    if (optimizer == null) {
      return OptimizerOutcome.notConfigured();
    }
    OptimizerRequest request = buildRequest(conn, factoryId, stage, config, pool, simMinute);
    OptimizerOutcome outcome = optimizerBridge.invoke(optimizer, request);
    schedulingLog.append(factoryId, stage, LogMode.OPTIMIZER_RUN, runDetails(request, outcome));
    return outcome;
  }

  private OptimizerRequest buildRequest(Connection conn, String factoryId, Stage stage,
      StageConfig config, List<QueueEntry> pool, long simMinute) {
    Map<String, OrderInfo> infos = orderDirectory.findOrders(conn, orderIds(pool));
    List<OptimizerOrder> orders = new ArrayList<>(pool.size());
    for (QueueEntry entry : pool) {
      Map<String, Object> meta = new LinkedHashMap<>();
      OrderInfo info = infos.get(entry.orderId());
      if (info != null) {
        meta.putAll(info.meta());
      }
      meta.put("queuedAtSimMinute", entry.queuedAtSimMinute());
      meta.put("processingOrder", entry.processingOrder());
      meta.put("holdCount", entry.holdCount());
      if (entry.isOnHold(simMinute)) {
        meta.put("holdUntilSimMinute", entry.holdUntilSimMinute());
        meta.put("holdReason", entry.holdReason());
      }
      orders.add(new OptimizerOrder(entry.orderId(), entry.possibleSequence(), entry.processTimes(), meta));
    }
    Map<String, Object> requestConfig = new LinkedHashMap<>(optimizerSettings);
    requestConfig.put("stage", stage.code());
    requestConfig.put("releaseAfterMinutes", config.releaseAfterMinutes());
    requestConfig.put("batchStartSimMinute", config.batchStartSimMinute());
    return new OptimizerRequest(factoryId, stage, simMinute, orders, requestConfig);
  }

  private static Map<String, Object> runDetails(OptimizerRequest request, OptimizerOutcome outcome) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("simMinute", request.nowSimMinute());
    details.put("optimizer", outcome.optimizer());
    details.put("orderCount", request.orders().size());
    details.put("durationMs", outcome.durationMs());
    details.put("success", outcome.hasResult());
    if (outcome.failed()) {
      details.put("error", outcome.failure());
    }
    OptimizerResult result = outcome.result();
    if (result != null) {
      details.put("releaseList", result.releaseList());
      details.put("batchCount", result.batches() == null ? 0 : result.batches().size());
      details.put("etaCount", result.etaList() == null ? 0 : result.etaList().size());
      details.put("holdDecisionCount", result.holdDecisions() == null ? 0 : result.holdDecisions().size());
      details.put("debug", result.debug());
    }
    return details;
  }

  private static Map<String, Object> summaryDetails(BatchReleaseOutcome outcome,
      OptimizerOutcome optimized, OptimizerResult result, long simMinute) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("simMinute", simMinute);
    details.put("releasedOrderIds", outcome.orderIds());
    details.put("releasedCount", outcome.orderIds().size());
    details.put("holdCount", outcome.holdCount());
    details.put("clearedHoldCount", outcome.clearedHoldCount());
    details.put("optimizer", optimized.optimizer());
    details.put("optimized", outcome.optimized());
    details.put("optimizerFailed", optimized.failed());
    details.put("reorderCount", outcome.reorderCount());
    details.put("diffCount", outcome.diffCount());
    details.put("etaWrites", outcome.etaWrites());
    details.put("etaFailures", outcome.etaFailures());
    if (result != null && result.batches() != null) {
      List<Integer> batchSizes = new ArrayList<>();
      for (OptimizerResult.Batch batch : result.batches()) {
        batchSizes.add(batch.orderIds().size());
      }
      details.put("batchSizes", batchSizes);
    }
    return details;
  }

  // ---------------------------------------------------------------------------------------
  // Scheduling log

  /**
   * Newest scheduling log entries of a factory.
   *
   * @param stage one stage, or {@code null} for all
   */
  public StageResult<List<SchedulingLogEntry>> recentLogs(String factoryId, Stage stage, int limit) {
    if (factoryId == null || limit <= 0) {
      return invalid("factoryId is required and limit must be > 0");
    }
    return StageResult.success(schedulingLog.recent(factoryId, stage, limit));
  }

  /**
   * Deletes every scheduling log entry of a factory and forgets the dispatch sequence
   * numbers of its orders in every stage.
   */
  public StageResult<LogResetOutcome> clearLogs(String factoryId) {
    if (factoryId == null) {
      return invalid("factoryId is required");
    }
    int deleted = schedulingLog.clear(factoryId);
    if (deleted < 0) {
      return StageResult.failure(ErrorKind.PERSISTENCE, "Failed to clear scheduling log of " + factoryId);
    }
    return run("reset dispatch order of factory " + factoryId, conn -> {
      int reset = 0;
      for (Stage stage : Stage.values()) {
        reset += locks.withLock(factoryId, stage,
            () -> dispatchOrderStore.clearFactory(conn, stage, factoryId));
      }
      int resetCount = reset;
      logger.info(() -> "Deleted " + deleted + " scheduling log entries and reset " + resetCount
          + " dispatch sequence numbers for factory " + factoryId);
      return StageResult.success(new LogResetOutcome(deleted, reset));
    });
  }

  // ---------------------------------------------------------------------------------------

  private Optional<QueueEntry> findPending(Connection conn, Stage stage, String orderId) {
    return queueStore.find(conn, stage, orderId).filter(QueueEntry::isPending);
  }

  private void notifyReleased(String factoryId, Stage stage, BatchReleaseOutcome outcome) {
    for (ReleaseInterceptor interceptor : interceptors) {
      try {
        interceptor.afterRelease(factoryId, stage, outcome);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Interceptor afterRelease failed for " + stage.code(), e);
      }
    }
  }

  private static Set<String> orderIds(List<QueueEntry> entries) {
    Set<String> ids = new LinkedHashSet<>();
    for (QueueEntry entry : entries) {
      ids.add(entry.orderId());
    }
    return ids;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static <T> StageResult<T> invalid(String message) {
    return StageResult.failure(ErrorKind.INVALID_ARGUMENT, message);
  }

  private static <T> StageResult<T> notPending(Stage stage, String orderId) {
    return StageResult.failure(ErrorKind.NOT_FOUND,
        "Order " + orderId + " is not pending in " + stage.code());
  }

  private static String describe(Throwable t) {
    return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
  }

  private <T> StageResult<T> run(String action, SqlFunction<StageResult<T>> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.apply(conn);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action, e);
      return StageResult.failure(ErrorKind.PERSISTENCE, "Failed to " + action + ": " + describe(e));
    }
  }

  private static <T> T inTransaction(Connection conn, StageLocks.LockedAction<T, SQLException> op)
      throws SQLException {
    conn.setAutoCommit(false);
    try {
      T value = op.run();
      conn.commit();
      return value;
    } catch (SQLException | RuntimeException e) {
      conn.rollback();
      throw e;
    } finally {
      conn.setAutoCommit(true);
    }
  }

  @FunctionalInterface
  private interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }

  /**
   * Stops the optimizer worker pool, interrupting in-flight optimizer calls.
   */
  @Override
  public void close() {
    optimizerBridge.close();
  }

  /** Builder for {@link StageScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private QueueStore queueStore;
    private StageConfigRepository configRepository;
    private OrderDirectory orderDirectory;
    private DeliveryDateStore deliveryDateStore;
    private DispatchOrderStore dispatchOrderStore;
    private SchedulingLogStore schedulingLogStore;
    private OptimizerResolver optimizerResolver;
    private Duration optimizerTimeout = OptimizerBridge.DEFAULT_TIMEOUT;
    private Map<String, Object> optimizerSettings;
    private SimClock clock;
    private MetricsExporter metrics;
    private final List<ReleaseInterceptor> interceptors = new ArrayList<>();

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder queueStore(QueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder configRepository(StageConfigRepository configRepository) {
      this.configRepository = configRepository;
      return this;
    }

    /**
     * Sets the lookup used to resolve an order's factory and optimizer metadata.
     *
     * <p><b>Required.</b>
     */
    public Builder orderDirectory(OrderDirectory orderDirectory) {
      this.orderDirectory = orderDirectory;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder deliveryDateStore(DeliveryDateStore deliveryDateStore) {
      this.deliveryDateStore = deliveryDateStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder dispatchOrderStore(DispatchOrderStore dispatchOrderStore) {
      this.dispatchOrderStore = dispatchOrderStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder schedulingLogStore(SchedulingLogStore schedulingLogStore) {
      this.schedulingLogStore = schedulingLogStore;
      return this;
    }

    /**
     * Sets how the optimizer for a factory's stage is chosen.
     *
     * <p>Optional. Defaults to {@link OptimizerResolver#NONE} (FIFO releases).
     */
    public Builder optimizerResolver(OptimizerResolver optimizerResolver) {
      this.optimizerResolver = optimizerResolver;
      return this;
    }

    /**
     * Sets the maximum duration of one optimizer call.
     *
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder optimizerTimeout(Duration optimizerTimeout) {
      this.optimizerTimeout = optimizerTimeout;
      return this;
    }

    /**
     * Sets the settings sent in every optimizer request's {@code config} object.
     *
     * <p>Optional. Defaults to {@link OptimizerRequest#DEFAULT_SETTINGS}.
     */
    public Builder optimizerSettings(Map<String, Object> optimizerSettings) {
      this.optimizerSettings = optimizerSettings;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link SimClock#UNANCHORED}.
     */
    public Builder clock(SimClock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder interceptor(ReleaseInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<ReleaseInterceptor> interceptors) {
      for (ReleaseInterceptor interceptor : interceptors) {
        interceptor(interceptor);
      }
      return this;
    }

    /**
     * @throws NullPointerException if a required component is missing
     */
    public StageScheduler build() {
      return new StageScheduler(this);
    }
  }
}
