package stagequeue;

import stagequeue.model.QueueEntry;
import stagequeue.model.Stage;

/**
 * Observer notified after entries enter or leave a stage queue.
 *
 * <p>Hooks run on the calling thread after the change is committed. Exceptions thrown
 * by a hook are logged and ignored; they never change the operation's result.
 *
 * <pre>{@code
 * StageScheduler.builder()
 *     .interceptor(ReleaseInterceptor.afterRelease((factoryId, stage, outcome) ->
 *         downstream.notify(stage, outcome.orderIds())))
 *     ...
 * }</pre>
 */
public interface ReleaseInterceptor {

  default void afterEnqueue(QueueEntry entry) {
  }

  /**
   * Called after a batch release or single-item release committed at least one entry.
   */
  default void afterRelease(String factoryId, Stage stage, BatchReleaseOutcome outcome) {
  }

  static ReleaseInterceptor afterRelease(AfterReleaseHook hook) {
    return new ReleaseInterceptor() {
      @Override
      public void afterRelease(String factoryId, Stage stage, BatchReleaseOutcome outcome) {
        hook.accept(factoryId, stage, outcome);
      }
    };
  }

  @FunctionalInterface
  interface AfterReleaseHook {
    void accept(String factoryId, Stage stage, BatchReleaseOutcome outcome);
  }
}
