package stagequeue.hold;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import stagequeue.InMemoryStores;
import stagequeue.model.QueueEntry;
import stagequeue.model.Stage;
import stagequeue.optimizer.OptimizerResult.HoldDecision;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HoldRegistryTest {
  private static final Stage STAGE = Stage.POST_INSPECTION;

  private InMemoryStores stores;
  private HoldRegistry registry;

  @BeforeEach
  void setUp() {
    stores = new InMemoryStores();
    registry = new HoldRegistry(stores.queue);
    long order = 1;
    for (String id : List.of("A", "B", "C")) {
      stores.queue.insert(null, new QueueEntry("e-" + id, "F1", id, STAGE, null, null, order++, 0, 0,
          null, null, null, null, 0));
    }
  }

  private QueueEntry entry(String orderId) {
    return stores.queue.find(null, STAGE, orderId).orElseThrow();
  }

  @Test
  void setHoldOnlyAffectsPendingEntries() {
    assertTrue(registry.setHold(null, STAGE, "A", 40, "qa", 10));
    stores.queue.markReleased(null, STAGE, List.of("B"), 10);

    assertFalse(registry.setHold(null, STAGE, "B", 40, "qa", 10));
    assertFalse(registry.setHold(null, STAGE, "missing", 40, "qa", 10));
    assertEquals(1, entry("A").holdCount());
    assertEquals(0, entry("B").holdCount());
  }

  @Test
  void partitionClearsExpiredHoldsAndKeepsInputOrder() {
    registry.setHold(null, STAGE, "A", 20, "qa", 0);
    registry.setHold(null, STAGE, "B", 50, "qa", 0);

    HoldPartition partition = registry.partition(null, STAGE, stores.queue.listPending(null, STAGE), 20);

    assertEquals(List.of("A", "B", "C"), partition.pending().stream().map(QueueEntry::orderId).toList());
    assertEquals(Set.of("B"), partition.heldOrderIds(20));
    assertEquals(Set.of(), partition.heldOrderIds(50));
    assertEquals(1, partition.clearedCount());
    assertFalse(entry("A").hasHold());
    assertEquals(1, entry("A").holdCount());
    assertFalse(partition.pending().get(0).hasHold());
  }

  @Test
  void setMultipleReportsEachItem() {
    HoldBatchOutcome outcome = registry.setMultiple(null, STAGE, List.of(
        new HoldRequest("A", 30, "material"),
        new HoldRequest("B", 30, null),
        new HoldRequest("missing", 30, "material")), 0);

    assertEquals(1, outcome.applied());
    assertTrue(outcome.items().get(0).applied());
    assertEquals("reason is required", outcome.items().get(1).error());
    assertFalse(outcome.items().get(2).applied());
  }

  @Test
  void applyDecisionsAcceptsOnlyValidFutureHoldsForPooledOrders() {
    List<String> applied = registry.applyDecisions(null, STAGE, List.of(
        new HoldDecision("A", 60L, "wait for parts"),
        new HoldDecision("B", 10L, "already past"),
        new HoldDecision("C", 60L, ""),
        new HoldDecision("C", null, "no deadline"),
        new HoldDecision("D", 60L, "not pooled")), Set.of("A", "B", "C", "D"), 10);

    assertEquals(List.of("A"), applied);
    assertEquals("wait for parts", entry("A").holdReason());
    assertFalse(entry("B").hasHold());
    assertFalse(entry("C").hasHold());
  }

  @Test
  void applyDecisionsIgnoresOrdersOutsideThePool() {
    List<String> applied = registry.applyDecisions(null, STAGE,
        List.of(new HoldDecision("C", 60L, "late")), Set.of("A", "B"), 0);

    assertTrue(applied.isEmpty());
    assertFalse(entry("C").hasHold());
  }

  @Test
  void applyDecisionsToleratesNull() {
    assertTrue(registry.applyDecisions(null, STAGE, null, Set.of("A"), 0).isEmpty());
  }
}
