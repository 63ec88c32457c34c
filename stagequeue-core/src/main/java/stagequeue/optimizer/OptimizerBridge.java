package stagequeue.optimizer;

import stagequeue.spi.MetricsExporter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Calls an {@link Optimizer} once, bounded by a timeout, and never throws.
 *
 * <p>Each call runs on a daemon worker thread. Exceptions, timeouts, interrupts and
 * results failing {@link OptimizerResult#validate()} are logged at WARNING, counted via
 * {@link MetricsExporter#incrementOptimizerFailure}, and reported as an
 * {@link OptimizerOutcome} with a {@code null} result. Calls are never retried.
 */
public final class OptimizerBridge implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OptimizerBridge.class.getName());

  /** Default call timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final Duration timeout;
  private final MetricsExporter metrics;
  private final ExecutorService workers;

  private OptimizerBridge(Builder builder) {
    this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.workers = Executors.newCachedThreadPool(new OptimizerThreadFactory());
  }

  public static Builder builder() {
    return new Builder();
  }

  public Duration timeout() {
    return timeout;
  }

  /**
   * Invokes {@code optimizer} with {@code request}.
   *
   * @param optimizer the optimizer, or {@code null} for none
   * @return the outcome; {@link OptimizerOutcome#notConfigured()} if {@code optimizer} is null
   */
  public OptimizerOutcome invoke(Optimizer optimizer, OptimizerRequest request) {
    if (optimizer == null) {
      return OptimizerOutcome.notConfigured();
    }
    String name = optimizer.name();
    long start = System.nanoTime();
    Future<OptimizerResult> future = workers.submit(() -> optimizer.optimize(request));
    String failure;
    Throwable cause;
    try {
      OptimizerResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (result == null) {
        result = OptimizerResult.EMPTY;
      }
      result.validate();
      long durationMs = elapsedMs(start);
      metrics.recordOptimizerDurationMs(request.stage(), durationMs);
      return new OptimizerOutcome(name, result, null, durationMs);
    } catch (TimeoutException e) {
      future.cancel(true);
      failure = "timed out after " + timeout.toMillis() + " ms";
      cause = e;
    } catch (ExecutionException e) {
      cause = e.getCause() != null ? e.getCause() : e;
      failure = describe(cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      failure = "interrupted";
      cause = e;
    } catch (RuntimeException e) {
      failure = "malformed result: " + describe(e);
      cause = e;
    }
    long durationMs = elapsedMs(start);
    logger.log(Level.WARNING, "Optimizer " + name + " failed for stage " + request.stage().code()
        + " factory=" + request.factoryId() + ": " + failure + "; falling back to FIFO order", cause);
    metrics.incrementOptimizerFailure(request.stage());
    metrics.recordOptimizerDurationMs(request.stage(), durationMs);
    return new OptimizerOutcome(name, null, failure, durationMs);
  }

  private static String describe(Throwable t) {
    return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  /**
   * Interrupts running optimizer calls and stops the worker pool.
   */
  @Override
  public void close() {
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.log(Level.WARNING, "Optimizer workers did not terminate within 5 s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link OptimizerBridge}. */
  public static final class Builder {
    private Duration timeout = DEFAULT_TIMEOUT;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the maximum time to wait for one optimizer call.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param timeout call timeout, must be positive
     * @return this builder
     */
    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * Sets the metrics exporter for failure counts and durations.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public OptimizerBridge build() {
      return new OptimizerBridge(this);
    }
  }
}
