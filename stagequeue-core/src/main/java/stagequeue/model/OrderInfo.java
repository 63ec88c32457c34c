package stagequeue.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of an order: its owning factory and the metadata forwarded
 * to the optimizer (due date, product group/variant, creation time).
 */
public record OrderInfo(String orderId, String factoryId, Map<String, Object> meta) {
  public OrderInfo {
    meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
  }
}
