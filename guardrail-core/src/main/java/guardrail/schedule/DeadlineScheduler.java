package guardrail.schedule;

import guardrail.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded one-shot timer service backed by a min-heap of monotonic deadlines.
 *
 * <p>All bulkhead wait timeouts, retry backoff sleeps and session warning/expiry timers share
 * one instance, so shutting the scheduler down releases every timer at once. Tasks run on the
 * scheduler thread and must be short; anything that does I/O hands off to an executor.
 *
 * <p>Until {@link #start()} is called no thread exists and due timers only run through
 * {@link #runDue()}. Tests drive time that way with a manual {@link TimeSource}.
 *
 * <p>This class is thread-safe. {@link #start()} and {@link #close()} are synchronized.
 */
public final class DeadlineScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeadlineScheduler.class.getName());

  private static final long MAX_PARK_NANOS = TimeUnit.MILLISECONDS.toNanos(500);

  private static final int PENDING = 0;
  private static final int FIRED = 1;
  private static final int CANCELLED = 2;

  private final TimeSource timeSource;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition headChanged = lock.newCondition();
  private final PriorityQueue<Deadline> heap = new PriorityQueue<>();
  private final AtomicLong sequence = new AtomicLong();

  private Thread worker;
  private volatile boolean closed;

  public DeadlineScheduler() {
    this(TimeSource.SYSTEM);
  }

  public DeadlineScheduler(TimeSource timeSource) {
    this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
  }

  public TimeSource timeSource() {
    return timeSource;
  }

  /**
   * Starts the timer thread. Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if the scheduler has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DeadlineScheduler has been closed");
    }
    if (worker != null) {
      return;
    }
    worker = new DaemonThreadFactory("guardrail-timer-").newThread(this::timerLoop);
    worker.start();
  }

  /** True between {@link #start()} and {@link #close()}. */
  public synchronized boolean isRunning() {
    return worker != null && !closed;
  }

  /**
   * Registers {@code task} to run once {@code delay} has elapsed. A zero or negative delay
   * makes the task due immediately.
   *
   * @param delay time to wait, measured on the monotonic clock
   * @param task  action to run on the scheduler thread
   * @return a handle that can cancel the task
   * @throws IllegalStateException if the scheduler has been closed
   */
  public ScheduledTimer schedule(Duration delay, Runnable task) {
    Objects.requireNonNull(delay, "delay");
    Objects.requireNonNull(task, "task");
    long delayNanos = saturatedNanos(delay);
    Deadline deadline = new Deadline(timeSource.nanoTime() + delayNanos,
        sequence.getAndIncrement(), task);
    lock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("DeadlineScheduler has been closed");
      }
      heap.add(deadline);
      if (heap.peek() == deadline) {
        headChanged.signal();
      }
    } finally {
      lock.unlock();
    }
    return deadline;
  }

  /**
   * Runs every task whose deadline has passed, in deadline order, on the calling thread.
   *
   * @return the number of tasks run
   */
  public int runDue() {
    int ran = 0;
    while (true) {
      Deadline next;
      lock.lock();
      try {
        next = heap.peek();
        if (next == null || next.deadlineNanos - timeSource.nanoTime() > 0) {
          return ran;
        }
        heap.poll();
      } finally {
        lock.unlock();
      }
      if (next.state.compareAndSet(PENDING, FIRED)) {
        ran++;
        try {
          next.task.run();
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Scheduled task failed", t);
        }
      }
    }
  }

  /**
   * @return number of timers registered and neither fired nor cancelled
   */
  public int pendingCount() {
    lock.lock();
    try {
      return heap.size();
    } finally {
      lock.unlock();
    }
  }

  private void timerLoop() {
    while (!closed) {
      runDue();
      lock.lock();
      try {
        if (closed) {
          break;
        }
        Deadline head = heap.peek();
        long waitNanos = head == null
            ? MAX_PARK_NANOS
            : Math.min(MAX_PARK_NANOS, head.deadlineNanos - timeSource.nanoTime());
        if (waitNanos > 0) {
          headChanged.awaitNanos(waitNanos);
        }
      } catch (InterruptedException e) {
        if (closed) {
          Thread.currentThread().interrupt();
          break;
        }
      } finally {
        lock.unlock();
      }
    }
  }

  private boolean remove(Deadline deadline) {
    lock.lock();
    try {
      return heap.remove(deadline);
    } finally {
      lock.unlock();
    }
  }

  private static long saturatedNanos(Duration delay) {
    if (delay.isNegative()) {
      return 0L;
    }
    try {
      return delay.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE / 2;
    }
  }

  /**
   * Cancels every pending timer and stops the timer thread. Cancelled tasks never run.
   */
  @Override
  public synchronized void close() {
    List<Deadline> dropped;
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      dropped = new ArrayList<>(heap);
      heap.clear();
      headChanged.signalAll();
    } finally {
      lock.unlock();
    }
    for (Deadline deadline : dropped) {
      deadline.state.compareAndSet(PENDING, CANCELLED);
    }
    if (!dropped.isEmpty()) {
      logger.log(Level.FINE, "Cancelled {0} pending timers on close", dropped.size());
    }
    if (worker != null) {
      worker.interrupt();
      try {
        worker.join(TimeUnit.SECONDS.toMillis(5));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private final class Deadline implements ScheduledTimer, Comparable<Deadline> {
    private final long deadlineNanos;
    private final long seq;
    private final Runnable task;
    private final AtomicInteger state = new AtomicInteger(PENDING);

    private Deadline(long deadlineNanos, long seq, Runnable task) {
      this.deadlineNanos = deadlineNanos;
      this.seq = seq;
      this.task = task;
    }

    @Override
    public boolean cancel() {
      if (!state.compareAndSet(PENDING, CANCELLED)) {
        return false;
      }
      remove(this);
      return true;
    }

    @Override
    public boolean hasFired() {
      return state.get() == FIRED;
    }

    @Override
    public boolean isCancelled() {
      return state.get() == CANCELLED;
    }

    @Override
    public int compareTo(Deadline other) {
      // Difference comparison keeps ordering correct across nanoTime overflow
      long diff = deadlineNanos - other.deadlineNanos;
      if (diff != 0) {
        return diff < 0 ? -1 : 1;
      }
      return Long.compare(seq, other.seq);
    }
  }
}
