package stagequeue;

/**
 * Result of resetting a factory's scheduling history.
 *
 * @param deletedLogs          scheduling log entries removed
 * @param resetDispatchOrders  dispatch sequence numbers forgotten, summed over all stages
 */
public record LogResetOutcome(int deletedLogs, int resetDispatchOrders) {}
