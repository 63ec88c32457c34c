package stagequeue.optimizer;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Daemon threads for optimizer calls, named {@code stagequeue-optimizer-N}.
 * A call abandoned after its timeout keeps running here without blocking JVM exit.
 */
final class OptimizerThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(OptimizerThreadFactory.class.getName());
  static final String NAME_PREFIX = "stagequeue-optimizer-";

  private final AtomicInteger counter = new AtomicInteger(1);

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, NAME_PREFIX + counter.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.WARNING, "Optimizer worker " + t.getName() + " died", e));
    return thread;
  }
}
