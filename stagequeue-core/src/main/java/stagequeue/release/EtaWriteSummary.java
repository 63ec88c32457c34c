package stagequeue.release;

import java.util.List;

/**
 * @param orderIds orders whose delivery date was written
 * @param failed   orders whose write failed
 */
public record EtaWriteSummary(List<String> orderIds, int failed) {
  public static final EtaWriteSummary NONE = new EtaWriteSummary(List.of(), 0);

  public EtaWriteSummary {
    orderIds = List.copyOf(orderIds);
  }

  public int written() {
    return orderIds.size();
  }
}
