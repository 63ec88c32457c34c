package stagequeue.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the {@code stagequeue.jdbc.store}
 * implementations. {@code StageScheduler} maps it to a {@code PERSISTENCE} failure.
 */
public final class QueueStoreException extends RuntimeException {
  public QueueStoreException(String message) {
    super(message);
  }

  public QueueStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
