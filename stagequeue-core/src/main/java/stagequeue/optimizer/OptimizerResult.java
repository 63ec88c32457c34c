package stagequeue.optimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Output of an optimizer call. Every field is optional: {@code null} means "no opinion".
 *
 * @param batches       groupings of order ids with optional release hints
 * @param releaseList   total order in which ids should be released
 * @param etaList       estimated completion per order, in sim-minutes from now
 * @param priorities    per-order priority annotations
 * @param holdDecisions holds the optimizer asks the scheduler to apply
 * @param debug         free-form diagnostic trace, never interpreted
 */
public record OptimizerResult(
    List<Batch> batches,
    List<String> releaseList,
    List<EtaPrediction> etaList,
    List<Priority> priorities,
    List<HoldDecision> holdDecisions,
    List<Object> debug
) {

  public static final OptimizerResult EMPTY = new OptimizerResult(null, null, null, null, null, null);

  /**
   * The ranking to reconcile against: {@code releaseList} if non-empty, otherwise the
   * member ids of {@code batches} flattened in batch order. Empty if neither is given.
   */
  public List<String> ranking() {
    if (releaseList != null && !releaseList.isEmpty()) {
      return releaseList;
    }
    List<String> flattened = new ArrayList<>();
    if (batches != null) {
      for (Batch batch : batches) {
        flattened.addAll(batch.orderIds());
      }
    }
    return flattened;
  }

  /**
   * Checks the result against the wire schema.
   *
   * @throws MalformedOptimizerOutputException if an element is missing its order id
   */
  public void validate() {
    if (releaseList != null && hasNull(releaseList)) {
      throw new MalformedOptimizerOutputException("releaseList contains null id");
    }
    if (batches != null) {
      for (Batch batch : batches) {
        if (batch == null || batch.orderIds() == null || hasNull(batch.orderIds())) {
          throw new MalformedOptimizerOutputException("batch without orderIds");
        }
      }
    }
    if (etaList != null) {
      for (EtaPrediction eta : etaList) {
        if (eta == null || eta.orderId() == null) {
          throw new MalformedOptimizerOutputException("etaList entry without orderId");
        }
      }
    }
    if (priorities != null) {
      for (Priority priority : priorities) {
        if (priority == null || priority.orderId() == null) {
          throw new MalformedOptimizerOutputException("priorities entry without orderId");
        }
      }
    }
    if (holdDecisions != null && hasNull(holdDecisions)) {
      throw new MalformedOptimizerOutputException("holdDecisions contains null");
    }
  }

  // List.of(...) rejects contains(null), so scan instead.
  private static boolean hasNull(List<?> values) {
    for (Object value : values) {
      if (value == null) {
        return true;
      }
    }
    return false;
  }

  public record Batch(String id, List<String> orderIds, Long releaseAtSimMinute, Double score,
      Map<String, Object> meta) {}

  /**
   * @param eta        expected completion, sim-minutes from now
   * @param lower      lower bound, may be {@code null}
   * @param upper      upper bound, may be {@code null}
   * @param confidence confidence in {@code [0, 1]}, may be {@code null}
   */
  public record EtaPrediction(String orderId, Double eta, Double lower, Double upper,
      Double confidence) {

    /** {@code true} if {@code eta} is finite and strictly positive. */
    public boolean isUsable() {
      return eta != null && Double.isFinite(eta) && eta > 0;
    }
  }

  public record Priority(String orderId, Double priority, Long dueDate, Long expectedCompletion) {}

  public record HoldDecision(String orderId, Long holdUntilSimMinute, String reason) {}
}
