package stagequeue;

import java.util.Objects;

/**
 * Result of every public {@link StageScheduler} operation.
 *
 * <ul>
 *   <li>{@link Success} carries the operation's data. "Skipped" and "waiting" outcomes are
 *       successes; inspect the data to tell them apart.</li>
 *   <li>{@link Failure} carries an {@link ErrorKind} and a message. No exception crosses the
 *       scheduler boundary.</li>
 * </ul>
 *
 * @param <T> the data type of a successful result
 */
public sealed interface StageResult<T> permits StageResult.Success, StageResult.Failure {

  static <T> StageResult<T> success(T data) {
    return new Success<>(data);
  }

  static <T> StageResult<T> failure(ErrorKind kind, String message) {
    return new Failure<>(kind, message);
  }

  boolean isSuccess();

  /**
   * Returns the data of a successful result.
   *
   * @throws IllegalStateException if this is a {@link Failure}
   */
  T getOrThrow();

  /** Category of a failed operation. */
  enum ErrorKind {
    /** Referenced order, factory or config does not exist. */
    NOT_FOUND,
    /** Caller supplied an invalid value. */
    INVALID_ARGUMENT,
    /** A store write failed; the operation's transaction was rolled back. */
    PERSISTENCE
  }

  record Success<T>(T data) implements StageResult<T> {
    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public T getOrThrow() {
      return data;
    }
  }

  record Failure<T>(ErrorKind kind, String message) implements StageResult<T> {
    public Failure {
      Objects.requireNonNull(kind, "kind");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public T getOrThrow() {
      throw new IllegalStateException(kind + ": " + message);
    }
  }
}
