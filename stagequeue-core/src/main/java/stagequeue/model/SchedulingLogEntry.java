package stagequeue.model;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only record of one optimizer run or release summary.
 */
public record SchedulingLogEntry(
    String id,
    String factoryId,
    Stage stage,
    LogMode mode,
    Map<String, Object> details,
    Instant timestamp
) {}
