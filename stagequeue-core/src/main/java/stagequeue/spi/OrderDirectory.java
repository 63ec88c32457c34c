package stagequeue.spi;

import stagequeue.model.OrderInfo;

import java.sql.Connection;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of orders and factories owned by the surrounding application.
 */
public interface OrderDirectory {

    Optional<OrderInfo> findOrder(Connection conn, String orderId);

    /**
     * Looks up several orders. Missing orders are absent from the result.
     *
     * <p>Default loops {@link #findOrder}.
     */
    default Map<String, OrderInfo> findOrders(Connection conn, Collection<String> orderIds) {
        Map<String, OrderInfo> result = new LinkedHashMap<>();
        for (String orderId : orderIds) {
            findOrder(conn, orderId).ifPresent(info -> result.put(orderId, info));
        }
        return result;
    }

    boolean factoryExists(Connection conn, String factoryId);
}
