package guardrail.retry;

import guardrail.AsyncOperation;
import guardrail.schedule.DeadlineScheduler;
import guardrail.schedule.ScheduledTimer;
import guardrail.spi.MetricsExporter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.random.RandomGenerator;

/**
 * Runs an {@link AsyncOperation} with retries according to a {@link RetryPolicy}.
 *
 * <p>Attempts are strictly sequential. A failure the policy does not consider retryable is
 * propagated unchanged. A retryable failure on the last permitted attempt is wrapped in
 * {@link RetriesExhaustedException}. Between attempts no thread is blocked: the backoff is a
 * {@link DeadlineScheduler} timer whose task hands the next attempt to {@code executor}.
 *
 * <p>Cancelling the returned future stops further attempts and cancels a pending backoff
 * timer. An attempt already in flight is not interrupted.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RetryExecutor {
  private static final Logger logger = Logger.getLogger(RetryExecutor.class.getName());

  private final DeadlineScheduler scheduler;
  private final Executor executor;
  private final RetryListener listener;
  private final MetricsExporter metrics;
  private final RandomGenerator random;

  private RetryExecutor(Builder builder) {
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.executor = builder.executor != null ? builder.executor : ForkJoinPool.commonPool();
    this.listener = builder.listener != null ? builder.listener : RetryListener.NOOP;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.random = builder.random;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @param operationName name used in logs, metrics and {@link RetriesExhaustedException}
   * @param operation     the call to attempt
   * @param policy        attempt bound, backoff and retryability
   * @param <T>           the result type
   * @return a future completed by the first successful attempt or the terminal failure
   */
  public <T> CompletableFuture<T> withRetry(String operationName, AsyncOperation<T> operation,
      RetryPolicy policy) {
    Objects.requireNonNull(operationName, "operationName");
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(policy, "policy");
    RetryRun<T> run = new RetryRun<>(operationName, operation, policy);
    run.attempt(1);
    return run.result;
  }

  private final class RetryRun<T> {
    private final String operationName;
    private final AsyncOperation<T> operation;
    private final RetryPolicy policy;
    private final CompletableFuture<T> result = new CompletableFuture<>();
    private volatile ScheduledTimer backoffTimer;

    private RetryRun(String operationName, AsyncOperation<T> operation, RetryPolicy policy) {
      this.operationName = operationName;
      this.operation = operation;
      this.policy = policy;
      result.whenComplete((value, error) -> {
        ScheduledTimer timer = backoffTimer;
        if (timer != null) {
          timer.cancel();
        }
      });
    }

    private void attempt(int attemptNumber) {
      if (result.isDone()) {
        return;
      }
      CompletionStage<T> stage;
      try {
        stage = Objects.requireNonNull(operation.invoke(), "operation returned null");
      } catch (Throwable t) {
        stage = CompletableFuture.failedFuture(t);
      }
      stage.whenComplete((value, error) -> {
        if (error == null) {
          result.complete(value);
        } else {
          onFailure(attemptNumber, ErrorKind.unwrap(error));
        }
      });
    }

    private void onFailure(int attemptNumber, Throwable error) {
      if (result.isDone()) {
        return;
      }
      boolean retryable;
      try {
        retryable = policy.isRetryable(error);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "RetryClassifier failed for '" + operationName + "'", e);
        retryable = false;
      }
      if (!retryable) {
        result.completeExceptionally(error);
        return;
      }
      int maxAttempts = policy.maxAttempts();
      if (attemptNumber >= maxAttempts) {
        metrics.incrementRetriesExhausted(operationName);
        logger.log(Level.SEVERE, "Operation ''{0}'' failed after {1} attempts: {2}",
            new Object[]{operationName, attemptNumber, error.toString()});
        try {
          listener.onExhausted(operationName, error, attemptNumber);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "RetryListener failed for '" + operationName + "'", e);
        }
        result.completeExceptionally(
            new RetriesExhaustedException(operationName, attemptNumber, maxAttempts, error));
        return;
      }

      ExponentialBackoff backoff = policy.backoff();
      long delayMs = random != null
          ? backoff.computeDelayMs(attemptNumber - 1, random)
          : backoff.computeDelayMs(attemptNumber - 1);
      metrics.incrementRetryAttempt(operationName);
      logger.log(Level.WARNING, "Retry attempt {0}/{1} for ''{2}'' after {3}ms: {4}",
          new Object[]{attemptNumber, maxAttempts - 1, operationName, delayMs,
              error.getMessage()});
      try {
        listener.onRetry(operationName, error, attemptNumber, delayMs);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "RetryListener failed for '" + operationName + "'", e);
      }

      ScheduledTimer timer;
      try {
        timer = scheduler.schedule(Duration.ofMillis(delayMs), () -> resume(attemptNumber + 1));
      } catch (IllegalStateException e) {
        e.addSuppressed(error);
        result.completeExceptionally(e);
        return;
      }
      backoffTimer = timer;
      if (result.isDone()) {
        timer.cancel();
      }
    }

    // Runs on the scheduler thread; the attempt itself goes to the executor.
    private void resume(int attemptNumber) {
      try {
        executor.execute(() -> attempt(attemptNumber));
      } catch (RejectedExecutionException e) {
        result.completeExceptionally(e);
      }
    }
  }

  /** Builder for {@link RetryExecutor}. */
  public static final class Builder {
    private DeadlineScheduler scheduler;
    private Executor executor;
    private RetryListener listener;
    private MetricsExporter metrics;
    private RandomGenerator random;

    private Builder() {}

    /**
     * Sets the scheduler that runs backoff delays.
     *
     * <p><b>Required.</b>
     */
    public Builder scheduler(DeadlineScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Executor that runs attempts after a backoff delay.
     *
     * <p>Optional. Defaults to {@link ForkJoinPool#commonPool()}.
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    public Builder listener(RetryListener listener) {
      this.listener = listener;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Jitter source. Optional. Defaults to {@link java.util.concurrent.ThreadLocalRandom}.
     */
    public Builder random(RandomGenerator random) {
      this.random = random;
      return this;
    }

    public RetryExecutor build() {
      return new RetryExecutor(this);
    }
  }
}
