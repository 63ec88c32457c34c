package stagequeue.model;

import java.time.Instant;

/**
 * A delivery-date estimate for an order. Exactly one record per order is
 * {@code current}; older ones are kept as history.
 *
 * @param etaSimMinute absolute sim-minute of expected completion
 * @param calendarAt   wall-clock mapping of {@code etaSimMinute}, if a clock anchor is known
 */
public record DeliveryDateRecord(
    String id,
    String orderId,
    Stage stage,
    long etaSimMinute,
    Instant calendarAt,
    String optimizer,
    boolean current,
    Instant createdAt
) {}
