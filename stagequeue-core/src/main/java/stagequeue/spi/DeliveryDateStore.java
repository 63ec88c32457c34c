package stagequeue.spi;

import stagequeue.model.DeliveryDateRecord;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Delivery-date store with "supersede current, insert new current" semantics keyed by order id.
 *
 * @see stagequeue.jdbc.store.JdbcDeliveryDateStore
 */
public interface DeliveryDateStore {

    /**
     * Marks every current record of {@code record.orderId()} as not current, then inserts
     * {@code record} as the new current one.
     *
     * @return the number of records superseded
     */
    int supersedeAndInsert(Connection conn, DeliveryDateRecord record);

    Optional<DeliveryDateRecord> findCurrent(Connection conn, String orderId);

    /** All records of an order, newest first. */
    List<DeliveryDateRecord> history(Connection conn, String orderId);
}
