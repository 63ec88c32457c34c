package stagequeue;

import stagequeue.model.DeliveryDateRecord;
import stagequeue.model.OrderInfo;
import stagequeue.model.QueueEntry;
import stagequeue.model.SchedulingLogEntry;
import stagequeue.model.Stage;
import stagequeue.model.StageConfig;
import stagequeue.spi.ConnectionProvider;
import stagequeue.spi.DeliveryDateStore;
import stagequeue.spi.DispatchOrderStore;
import stagequeue.spi.OrderDirectory;
import stagequeue.spi.QueueStore;
import stagequeue.spi.SchedulingLogStore;
import stagequeue.spi.StageConfigRepository;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * In-memory implementations of every persistence SPI, with switches for injecting failures.
 * Connections are dummies; nothing is transactional.
 */
public final class InMemoryStores {

  public final Queue queue = new Queue();
  public final Configs configs = new Configs();
  public final Orders orders = new Orders();
  public final DeliveryDates deliveryDates = new DeliveryDates();
  public final Dispatch dispatch = new Dispatch(orders);
  public final Logs logs = new Logs();

  public static Connection dummyConnection() {
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> null);
  }

  public static ConnectionProvider dummyProvider() {
    return InMemoryStores::dummyConnection;
  }

  public StageScheduler.Builder schedulerBuilder() {
    return StageScheduler.builder()
        .connectionProvider(dummyProvider())
        .queueStore(queue)
        .configRepository(configs)
        .orderDirectory(orders)
        .deliveryDateStore(deliveryDates)
        .dispatchOrderStore(dispatch)
        .schedulingLogStore(logs);
  }

  public static final class Queue implements QueueStore {
    private final Map<String, QueueEntry> entries = new LinkedHashMap<>();
    public volatile boolean failMarkReleased;

    @Override
    public synchronized Optional<QueueEntry> find(Connection conn, Stage stage, String orderId) {
      return entries.values().stream()
          .filter(e -> e.stage() == stage && e.orderId().equals(orderId))
          .findFirst();
    }

    @Override
    public synchronized boolean insert(Connection conn, QueueEntry entry) {
      if (find(conn, entry.stage(), entry.orderId()).isPresent()) {
        return false;
      }
      entries.put(entry.id(), entry);
      return true;
    }

    @Override
    public synchronized int delete(Connection conn, String entryId) {
      return entries.remove(entryId) != null ? 1 : 0;
    }

    @Override
    public synchronized long maxProcessingOrder(Connection conn, Stage stage) {
      return entries.values().stream()
          .filter(e -> e.stage() == stage)
          .mapToLong(QueueEntry::processingOrder)
          .max().orElse(0);
    }

    /** Runs once, outside the store monitor, after the next stage-wide scan. */
    public volatile Runnable afterStageScan;

    @Override
    public List<QueueEntry> listPending(Connection conn, Stage stage) {
      List<QueueEntry> pending;
      synchronized (this) {
        pending = entries.values().stream()
            .filter(e -> e.stage() == stage && e.isPending())
            .sorted(Comparator.comparingLong(QueueEntry::processingOrder)
                .thenComparingLong(QueueEntry::queuedAtSimMinute))
            .toList();
      }
      Runnable hook = afterStageScan;
      if (hook != null) {
        afterStageScan = null;
        hook.run();
      }
      return pending;
    }

    @Override
    public synchronized List<QueueEntry> listPending(Connection conn, String factoryId, Stage stage) {
      return listPending(conn, stage).stream()
          .filter(e -> e.factoryId().equals(factoryId))
          .toList();
    }

    @Override
    public synchronized int markReleased(Connection conn, Stage stage, Collection<String> orderIds,
        long simMinute) {
      if (failMarkReleased) {
        throw new IllegalStateException("markReleased failed");
      }
      int count = 0;
      for (String orderId : orderIds) {
        Optional<QueueEntry> entry = find(conn, stage, orderId).filter(QueueEntry::isPending);
        if (entry.isPresent()) {
          QueueEntry e = entry.get();
          entries.put(e.id(), new QueueEntry(e.id(), e.factoryId(), e.orderId(), e.stage(),
              e.possibleSequence(), e.processTimes(), e.processingOrder(), e.queuedAtSimMinute(),
              e.releaseAfterMinutes(), simMinute, e.holdUntilSimMinute(), e.holdReason(),
              e.holdSetAtSimMinute(), e.holdCount()));
          count++;
        }
      }
      return count;
    }

    @Override
    public synchronized int setHold(Connection conn, Stage stage, String orderId,
        long holdUntilSimMinute, String reason, long holdSetAtSimMinute) {
      Optional<QueueEntry> entry = find(conn, stage, orderId).filter(QueueEntry::isPending);
      if (entry.isEmpty()) {
        return 0;
      }
      QueueEntry e = entry.get();
      entries.put(e.id(), new QueueEntry(e.id(), e.factoryId(), e.orderId(), e.stage(),
          e.possibleSequence(), e.processTimes(), e.processingOrder(), e.queuedAtSimMinute(),
          e.releaseAfterMinutes(), null, holdUntilSimMinute, reason, holdSetAtSimMinute,
          e.holdCount() + 1));
      return 1;
    }

    @Override
    public synchronized int clearHold(Connection conn, Stage stage, String orderId) {
      Optional<QueueEntry> entry = find(conn, stage, orderId).filter(QueueEntry::isPending);
      if (entry.isEmpty()) {
        return 0;
      }
      QueueEntry e = entry.get();
      entries.put(e.id(), new QueueEntry(e.id(), e.factoryId(), e.orderId(), e.stage(),
          e.possibleSequence(), e.processTimes(), e.processingOrder(), e.queuedAtSimMinute(),
          e.releaseAfterMinutes(), null, null, null, null, e.holdCount()));
      return 1;
    }

    @Override
    public synchronized int deleteReleased(Connection conn, Stage stage) {
      int before = entries.size();
      entries.values().removeIf(e -> e.stage() == stage && !e.isPending());
      return before - entries.size();
    }

    @Override
    public synchronized int deleteAll(Connection conn) {
      int count = entries.size();
      entries.clear();
      return count;
    }

    /** Removes an entry behind the scheduler's back. */
    public synchronized void removeExternally(Stage stage, String orderId) {
      entries.values().removeIf(e -> e.stage() == stage && e.orderId().equals(orderId));
    }

    public synchronized List<QueueEntry> all() {
      return new ArrayList<>(entries.values());
    }
  }

  public static final class Configs implements StageConfigRepository {
    private final Map<String, StageConfig> configs = new HashMap<>();

    private static String key(String factoryId, Stage stage) {
      return factoryId + "/" + stage;
    }

    @Override
    public synchronized Optional<StageConfig> find(Connection conn, String factoryId, Stage stage) {
      return Optional.ofNullable(configs.get(key(factoryId, stage)));
    }

    @Override
    public synchronized List<StageConfig> findByFactory(Connection conn, String factoryId) {
      return configs.values().stream().filter(c -> c.factoryId().equals(factoryId)).toList();
    }

    @Override
    public synchronized void saveSettings(Connection conn, String factoryId, Stage stage,
        int releaseAfterMinutes, String optimizerScript) {
      StageConfig current = configs.get(key(factoryId, stage));
      configs.put(key(factoryId, stage), new StageConfig(factoryId, stage, releaseAfterMinutes,
          current == null ? null : current.batchStartSimMinute(), optimizerScript, Instant.now()));
    }

    @Override
    public synchronized boolean openWindow(Connection conn, String factoryId, Stage stage,
        long simMinute) {
      StageConfig current = configs.get(key(factoryId, stage));
      if (current == null || current.batchStartSimMinute() != null) {
        return false;
      }
      configs.put(key(factoryId, stage), withWindow(current, simMinute));
      return true;
    }

    @Override
    public synchronized int closeWindow(Connection conn, String factoryId, Stage stage) {
      StageConfig current = configs.get(key(factoryId, stage));
      if (current == null || current.batchStartSimMinute() == null) {
        return 0;
      }
      configs.put(key(factoryId, stage), withWindow(current, null));
      return 1;
    }

    @Override
    public synchronized int closeAllWindows(Connection conn) {
      int count = 0;
      for (Map.Entry<String, StageConfig> entry : configs.entrySet()) {
        if (entry.getValue().batchStartSimMinute() != null) {
          entry.setValue(withWindow(entry.getValue(), null));
          count++;
        }
      }
      return count;
    }

    /** Sets a config directly, bypassing scheduler validation. */
    public synchronized void put(StageConfig config) {
      configs.put(key(config.factoryId(), config.stage()), config);
    }

    private static StageConfig withWindow(StageConfig c, Long start) {
      return new StageConfig(c.factoryId(), c.stage(), c.releaseAfterMinutes(), start,
          c.optimizerScript(), Instant.now());
    }
  }

  public static final class Orders implements OrderDirectory {
    private final Map<String, OrderInfo> orders = new HashMap<>();
    private final Set<String> factories = new HashSet<>();

    public synchronized Orders add(String orderId, String factoryId) {
      factories.add(factoryId);
      orders.put(orderId, new OrderInfo(orderId, factoryId,
          Map.of("dueDate", 600, "productGroup", "G1")));
      return this;
    }

    @Override
    public synchronized Optional<OrderInfo> findOrder(Connection conn, String orderId) {
      return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public synchronized boolean factoryExists(Connection conn, String factoryId) {
      return factories.contains(factoryId);
    }
  }

  public static final class DeliveryDates implements DeliveryDateStore {
    private final List<DeliveryDateRecord> records = new ArrayList<>();
    public final Set<String> failingOrders = new HashSet<>();
    public int supersededTotal;

    @Override
    public synchronized int supersedeAndInsert(Connection conn, DeliveryDateRecord record) {
      if (failingOrders.contains(record.orderId())) {
        throw new IllegalStateException("delivery date write failed for " + record.orderId());
      }
      int superseded = 0;
      for (int i = 0; i < records.size(); i++) {
        DeliveryDateRecord r = records.get(i);
        if (r.orderId().equals(record.orderId()) && r.current()) {
          records.set(i, new DeliveryDateRecord(r.id(), r.orderId(), r.stage(), r.etaSimMinute(),
              r.calendarAt(), r.optimizer(), false, r.createdAt()));
          superseded++;
        }
      }
      records.add(record);
      supersededTotal += superseded;
      return superseded;
    }

    @Override
    public synchronized Optional<DeliveryDateRecord> findCurrent(Connection conn, String orderId) {
      return records.stream().filter(r -> r.orderId().equals(orderId) && r.current()).findFirst();
    }

    @Override
    public synchronized List<DeliveryDateRecord> history(Connection conn, String orderId) {
      List<DeliveryDateRecord> result = new ArrayList<>();
      for (int i = records.size() - 1; i >= 0; i--) {
        if (records.get(i).orderId().equals(orderId)) {
          result.add(records.get(i));
        }
      }
      return result;
    }

    /** Seeds a pre-existing current record. */
    public synchronized void seed(String orderId, long etaSimMinute) {
      records.add(new DeliveryDateRecord("seed-" + orderId, orderId, Stage.PRE_ACCEPTANCE,
          etaSimMinute, null, "seed", true, Instant.now()));
    }
  }

  public static final class Dispatch implements DispatchOrderStore {
    private final Map<String, Integer> sequence = new HashMap<>();
    private final Orders orders;

    Dispatch(Orders orders) {
      this.orders = orders;
    }

    @Override
    public synchronized void write(Connection conn, Stage stage, List<String> orderIds) {
      for (int i = 0; i < orderIds.size(); i++) {
        sequence.put(stage + "/" + orderIds.get(i), i + 1);
      }
    }

    @Override
    public synchronized OptionalInt find(Connection conn, Stage stage, String orderId) {
      Integer value = sequence.get(stage + "/" + orderId);
      return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    @Override
    public synchronized int clearFactory(Connection conn, Stage stage, String factoryId) {
      int before = sequence.size();
      sequence.keySet().removeIf(key -> key.startsWith(stage + "/")
          && orders.findOrder(conn, key.substring(key.indexOf('/') + 1))
              .map(order -> order.factoryId().equals(factoryId)).orElse(false));
      return before - sequence.size();
    }
  }

  public static final class Logs implements SchedulingLogStore {
    private final List<SchedulingLogEntry> entries = new ArrayList<>();
    public volatile boolean failAppends;

    @Override
    public synchronized void append(Connection conn, SchedulingLogEntry entry) {
      if (failAppends) {
        throw new IllegalStateException("log store down");
      }
      entries.add(entry);
    }

    @Override
    public synchronized List<SchedulingLogEntry> recent(Connection conn, String factoryId, Stage stage,
        int limit) {
      List<SchedulingLogEntry> result = new ArrayList<>();
      for (int i = entries.size() - 1; i >= 0 && result.size() < limit; i--) {
        SchedulingLogEntry e = entries.get(i);
        if (e.factoryId().equals(factoryId) && (stage == null || e.stage() == stage)) {
          result.add(e);
        }
      }
      return result;
    }

    @Override
    public synchronized int deleteByFactory(Connection conn, String factoryId) {
      int before = entries.size();
      entries.removeIf(e -> e.factoryId().equals(factoryId));
      return before - entries.size();
    }

    public synchronized List<SchedulingLogEntry> all() {
      return new ArrayList<>(entries);
    }
  }
}
