package stagequeue.jdbc;

import stagequeue.StageScheduler;
import stagequeue.jdbc.store.JdbcDeliveryDateStore;
import stagequeue.jdbc.store.JdbcDispatchOrderStore;
import stagequeue.jdbc.store.JdbcOrderDirectory;
import stagequeue.jdbc.store.JdbcQueueStore;
import stagequeue.jdbc.store.JdbcSchedulingLogStore;
import stagequeue.jdbc.store.JdbcStageConfigRepository;
import stagequeue.util.JsonCodec;

import java.time.Clock;
import java.util.Objects;

/**
 * The complete set of JDBC stores sharing one table prefix.
 *
 * <pre>{@code
 * StageScheduler scheduler = JdbcStageStores.create("sq_")
 *     .applyTo(StageScheduler.builder())
 *     .connectionProvider(dataSource::getConnection)
 *     .build();
 * }</pre>
 */
public final class JdbcStageStores {
  private final JdbcQueueStore queueStore;
  private final JdbcStageConfigRepository configRepository;
  private final JdbcOrderDirectory orderDirectory;
  private final JdbcDeliveryDateStore deliveryDateStore;
  private final JdbcDispatchOrderStore dispatchOrderStore;
  private final JdbcSchedulingLogStore schedulingLogStore;

  private JdbcStageStores(String tablePrefix, JsonCodec jsonCodec) {
    TableNames.validatePrefix(tablePrefix);
    Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.queueStore = new JdbcQueueStore(tablePrefix);
    this.configRepository = new JdbcStageConfigRepository(tablePrefix, Clock.systemUTC());
    this.orderDirectory = new JdbcOrderDirectory(tablePrefix);
    this.deliveryDateStore = new JdbcDeliveryDateStore(tablePrefix);
    this.dispatchOrderStore = new JdbcDispatchOrderStore(tablePrefix);
    this.schedulingLogStore = new JdbcSchedulingLogStore(tablePrefix, jsonCodec);
  }

  public static JdbcStageStores create(String tablePrefix) {
    return new JdbcStageStores(tablePrefix, JsonCodec.getDefault());
  }

  /**
   * @param jsonCodec codec for scheduling-log details
   */
  public static JdbcStageStores create(String tablePrefix, JsonCodec jsonCodec) {
    return new JdbcStageStores(tablePrefix, jsonCodec);
  }

  /** Sets every store on {@code builder}; the connection provider is left to the caller. */
  public StageScheduler.Builder applyTo(StageScheduler.Builder builder) {
    return builder
        .queueStore(queueStore)
        .configRepository(configRepository)
        .orderDirectory(orderDirectory)
        .deliveryDateStore(deliveryDateStore)
        .dispatchOrderStore(dispatchOrderStore)
        .schedulingLogStore(schedulingLogStore);
  }

  public JdbcQueueStore queueStore() {
    return queueStore;
  }

  public JdbcStageConfigRepository configRepository() {
    return configRepository;
  }

  public JdbcOrderDirectory orderDirectory() {
    return orderDirectory;
  }

  public JdbcDeliveryDateStore deliveryDateStore() {
    return deliveryDateStore;
  }

  public JdbcDispatchOrderStore dispatchOrderStore() {
    return dispatchOrderStore;
  }

  public JdbcSchedulingLogStore schedulingLogStore() {
    return schedulingLogStore;
  }
}
