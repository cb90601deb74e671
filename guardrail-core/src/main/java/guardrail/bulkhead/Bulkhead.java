package guardrail.bulkhead;

import guardrail.AsyncOperation;
import guardrail.schedule.DeadlineScheduler;
import guardrail.schedule.ScheduledTimer;
import guardrail.schedule.TimeSource;
import guardrail.spi.MetricsExporter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Admission controller for one named service.
 *
 * <p>At most {@code maxConcurrency} operations run at once. Further requests wait in a FIFO
 * queue of at most {@code queueCapacity} entries, each guarded by a wait-timeout timer on the
 * shared {@link DeadlineScheduler}. A request arriving at a full queue fails immediately with
 * {@link QueueFullException}; a queued request whose timer fires first fails with
 * {@link AdmissionTimeoutException}. Failures of the wrapped operation itself are passed
 * through unchanged.
 *
 * <p>Active count, queue and statistics are only mutated while holding this bulkhead's lock,
 * so promotion of a queued entry and its timeout removal can never both succeed. Operations
 * are invoked and caller futures completed outside the lock. A timed-out caller is failed on
 * {@code executor}, never on the scheduler thread, so code chained on the future cannot delay
 * the timers of other services.
 *
 * <p>Instances are created by {@link BulkheadRegistry}. This class is thread-safe.
 */
public final class Bulkhead {
  private static final Logger logger = Logger.getLogger(Bulkhead.class.getName());

  private final String name;
  private final BulkheadConfig config;
  private final DeadlineScheduler scheduler;
  private final TimeSource timeSource;
  private final BulkheadListener listener;
  private final MetricsExporter metrics;
  private final Executor executor;

  private final ReentrantLock lock = new ReentrantLock();
  private final ArrayDeque<QueuedOperation<?>> queue = new ArrayDeque<>();
  private int active;
  private long totalExecuted;
  private long totalQueued;
  private long totalTimeouts;
  private long totalRejectedQueueFull;
  private long totalCleared;
  private double averageExecutionMillis;

  Bulkhead(String name, BulkheadConfig config, DeadlineScheduler scheduler,
      BulkheadListener listener, MetricsExporter metrics, Executor executor) {
    this.name = Objects.requireNonNull(name, "name");
    this.config = Objects.requireNonNull(config, "config");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.timeSource = scheduler.timeSource();
    this.listener = listener != null ? listener : BulkheadListener.NOOP;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public String name() {
    return name;
  }

  public BulkheadConfig config() {
    return config;
  }

  /**
   * Runs {@code operation} when capacity allows.
   *
   * @param operation the call to protect
   * @param <T>       the result type
   * @return a future completed with the operation's outcome, or failed with a
   *     {@link BulkheadRejectedException} if the operation was never started
   */
  public <T> CompletableFuture<T> execute(AsyncOperation<T> operation) {
    Objects.requireNonNull(operation, "operation");
    QueuedOperation<T> entry = new QueuedOperation<>(operation,
        timeSource.nanoTime(), timeSource.now());
    Admission admission;
    int activeNow;
    int queuedNow;
    lock.lock();
    try {
      if (queue.isEmpty() && active < config.maxConcurrency()) {
        active++;
        admission = Admission.RUN;
      } else if (queue.size() >= config.queueCapacity()) {
        totalRejectedQueueFull++;
        admission = Admission.REJECT;
      } else {
        entry.timer = scheduler.schedule(config.waitTimeout(), () -> onWaitTimeout(entry));
        queue.addLast(entry);
        totalQueued++;
        admission = Admission.QUEUE;
      }
      activeNow = active;
      queuedNow = queue.size();
    } finally {
      lock.unlock();
    }
    metrics.recordBulkheadState(name, activeNow, queuedNow);

    switch (admission) {
      case RUN -> {
        metrics.incrementBulkheadAdmitted(name);
        run(entry);
      }
      case REJECT -> {
        metrics.incrementBulkheadQueueFull(name);
        logger.log(Level.WARNING, "Bulkhead [{0}] queue is full - rejecting new operations", name);
        notifyListener(l -> l.onQueueFull(name, config.queueCapacity()));
        return CompletableFuture.failedFuture(
            new QueueFullException(name, config.queueCapacity(), config.maxConcurrency()));
      }
      case QUEUE -> {
        metrics.incrementBulkheadQueued(name);
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Operation queued in bulkhead [" + name + "] queueLength=" + queuedNow
              + " active=" + activeNow + " maxConcurrency=" + config.maxConcurrency());
        }
        entry.result.whenComplete((value, error) -> {
          if (entry.result.isCancelled()) {
            withdraw(entry);
          }
        });
      }
    }
    return entry.result;
  }

  private <T> void run(QueuedOperation<T> entry) {
    long startNanos = timeSource.nanoTime();
    CompletionStage<T> stage;
    try {
      stage = Objects.requireNonNull(entry.operation.invoke(), "operation returned null");
    } catch (Throwable t) {
      stage = CompletableFuture.failedFuture(t);
    }
    stage.whenComplete((value, error) -> finish(entry, startNanos, value, error));
  }

  private <T> void finish(QueuedOperation<T> entry, long startNanos, T value, Throwable error) {
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(timeSource.nanoTime() - startNanos);
    QueuedOperation<?> next;
    int activeNow;
    int queuedNow;
    lock.lock();
    try {
      active--;
      totalExecuted++;
      averageExecutionMillis += (elapsedMs - averageExecutionMillis) / totalExecuted;
      next = promoteLocked();
      activeNow = active;
      queuedNow = queue.size();
    } finally {
      lock.unlock();
    }
    metrics.recordBulkheadExecutionMs(name, elapsedMs);
    metrics.recordBulkheadState(name, activeNow, queuedNow);

    if (error == null) {
      entry.result.complete(value);
    } else {
      entry.result.completeExceptionally(unwrap(error));
    }
    if (next != null) {
      metrics.incrementBulkheadAdmitted(name);
      run(next);
    }
  }

  // Caller must hold the lock.
  private QueuedOperation<?> promoteLocked() {
    while (active < config.maxConcurrency() && !queue.isEmpty()) {
      QueuedOperation<?> head = queue.pollFirst();
      head.timer.cancel();
      if (head.result.isDone()) {
        continue;
      }
      active++;
      return head;
    }
    return null;
  }

  private void onWaitTimeout(QueuedOperation<?> entry) {
    boolean removed;
    int activeNow;
    int queuedNow;
    lock.lock();
    try {
      removed = queue.remove(entry);
      if (removed) {
        totalTimeouts++;
      }
      activeNow = active;
      queuedNow = queue.size();
    } finally {
      lock.unlock();
    }
    if (!removed) {
      return;
    }
    metrics.incrementBulkheadTimeout(name);
    metrics.recordBulkheadState(name, activeNow, queuedNow);
    logger.log(Level.SEVERE, "Bulkhead [{0}] operation timed out after {1}ms in queue",
        new Object[]{name, config.waitTimeout().toMillis()});
    AdmissionTimeoutException timeout = new AdmissionTimeoutException(name, config.waitTimeout());
    Runnable reject = () -> {
      entry.result.completeExceptionally(timeout);
      notifyListener(l -> l.onAdmissionTimeout(name, config.waitTimeout()));
    };
    try {
      executor.execute(reject);
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Executor rejected timeout handling for bulkhead [" + name
          + "]; completing on the timer thread", e);
      reject.run();
    }
  }

  private void withdraw(QueuedOperation<?> entry) {
    lock.lock();
    try {
      if (queue.remove(entry)) {
        entry.timer.cancel();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Rejects every waiting operation with {@link QueueClearedException} and cancels its timer.
   * Running operations are not affected.
   *
   * @param reason recorded in the exception and the log
   * @return the number of operations cancelled
   */
  public int clearQueue(String reason) {
    String why = reason != null ? reason : "Manual clear";
    List<QueuedOperation<?>> drained;
    lock.lock();
    try {
      drained = new ArrayList<>(queue);
      queue.clear();
      for (QueuedOperation<?> entry : drained) {
        entry.timer.cancel();
      }
      totalCleared += drained.size();
    } finally {
      lock.unlock();
    }
    for (QueuedOperation<?> entry : drained) {
      entry.result.completeExceptionally(new QueueClearedException(name, why));
    }
    if (!drained.isEmpty()) {
      logger.log(Level.WARNING, "Bulkhead [{0}] queue cleared: {1} operations cancelled ({2})",
          new Object[]{name, drained.size(), why});
      metrics.recordBulkheadState(name, activeCount(), 0);
      notifyListener(l -> l.onQueueCleared(name, drained.size(), why));
    }
    return drained.size();
  }

  public int activeCount() {
    lock.lock();
    try {
      return active;
    } finally {
      lock.unlock();
    }
  }

  public int queuedCount() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  public BulkheadStats stats() {
    lock.lock();
    try {
      return new BulkheadStats(name, config, active, queue.size(), totalExecuted, totalQueued,
          totalTimeouts, totalRejectedQueueFull, totalCleared, averageExecutionMillis);
    } finally {
      lock.unlock();
    }
  }

  public QueueInfo queueInfo() {
    long now = timeSource.nanoTime();
    lock.lock();
    try {
      if (queue.isEmpty()) {
        return new QueueInfo(0, config.queueCapacity(), Duration.ZERO, null);
      }
      long totalWait = 0L;
      for (QueuedOperation<?> entry : queue) {
        totalWait += now - entry.enqueuedNanos;
      }
      return new QueueInfo(queue.size(), config.queueCapacity(),
          Duration.ofNanos(totalWait / queue.size()), queue.peekFirst().enqueuedAt);
    } finally {
      lock.unlock();
    }
  }

  private void notifyListener(Consumer<BulkheadListener> call) {
    try {
      call.accept(listener);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "BulkheadListener failed for [" + name + "]", e);
    }
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  private enum Admission {
    RUN,
    QUEUE,
    REJECT
  }

  /**
   * One pending admission request. Owned by the queue from enqueue until promotion, timeout
   * or clear.
   */
  private static final class QueuedOperation<T> {
    private final AsyncOperation<T> operation;
    private final CompletableFuture<T> result = new CompletableFuture<>();
    private final long enqueuedNanos;
    private final Instant enqueuedAt;
    private ScheduledTimer timer;

    private QueuedOperation(AsyncOperation<T> operation, long enqueuedNanos, Instant enqueuedAt) {
      this.operation = operation;
      this.enqueuedNanos = enqueuedNanos;
      this.enqueuedAt = enqueuedAt;
    }
  }
}
