package stagequeue.batch;

import stagequeue.model.Stage;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ConcurrentHashMap}-based mutual exclusion per {@code (factoryId, stage)}.
 *
 * <p>Every mutation that affects release eligibility runs under the lock of its
 * factory and stage. Different factories or stages never contend.
 *
 * <p>This class is thread-safe.
 */
public final class StageLocks {
  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  /**
   * Runs {@code action} while holding the lock of {@code (factoryId, stage)}.
   * The lock is reentrant.
   */
  public <T, E extends Exception> T withLock(String factoryId, Stage stage,
      LockedAction<T, E> action) throws E {
    ReentrantLock lock = locks.computeIfAbsent(key(factoryId, stage), k -> new ReentrantLock());
    lock.lock();
    try {
      return action.run();
    } finally {
      lock.unlock();
    }
  }

  private static String key(String factoryId, Stage stage) {
    return factoryId + '/' + stage.code();
  }

  @FunctionalInterface
  public interface LockedAction<T, E extends Exception> {
    T run() throws E;
  }
}
