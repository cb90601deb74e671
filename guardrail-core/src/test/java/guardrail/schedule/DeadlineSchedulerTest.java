package guardrail.schedule;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineSchedulerTest {

  @Test
  void tasksRunOnlyOnceDue() {
    ManualTimeSource time = new ManualTimeSource();
    DeadlineScheduler scheduler = new DeadlineScheduler(time);
    AtomicInteger runs = new AtomicInteger();

    ScheduledTimer timer = scheduler.schedule(Duration.ofSeconds(5), runs::incrementAndGet);

    assertEquals(0, scheduler.runDue());
    time.advance(Duration.ofMillis(4999));
    assertEquals(0, scheduler.runDue());
    time.advance(Duration.ofMillis(1));
    assertEquals(1, scheduler.runDue());
    assertEquals(1, runs.get());
    assertTrue(timer.hasFired());
    assertEquals(0, scheduler.pendingCount());
  }

  @Test
  void tasksRunInDeadlineOrderThenRegistrationOrder() {
    ManualTimeSource time = new ManualTimeSource();
    DeadlineScheduler scheduler = new DeadlineScheduler(time);
    List<String> order = new ArrayList<>();

    scheduler.schedule(Duration.ofSeconds(3), () -> order.add("c"));
    scheduler.schedule(Duration.ofSeconds(1), () -> order.add("a"));
    scheduler.schedule(Duration.ofSeconds(2), () -> order.add("b1"));
    scheduler.schedule(Duration.ofSeconds(2), () -> order.add("b2"));

    time.advanceAndRun(scheduler, Duration.ofSeconds(10));

    assertEquals(List.of("a", "b1", "b2", "c"), order);
  }

  @Test
  void cancelledTaskNeverRuns() {
    ManualTimeSource time = new ManualTimeSource();
    DeadlineScheduler scheduler = new DeadlineScheduler(time);
    AtomicInteger runs = new AtomicInteger();

    ScheduledTimer timer = scheduler.schedule(Duration.ofSeconds(1), runs::incrementAndGet);
    assertTrue(timer.cancel());
    assertTrue(timer.isCancelled());
    assertEquals(0, scheduler.pendingCount());

    time.advanceAndRun(scheduler, Duration.ofSeconds(2));
    assertEquals(0, runs.get());
  }

  @Test
  void cancelAfterFiringIsHarmless() {
    ManualTimeSource time = new ManualTimeSource();
    DeadlineScheduler scheduler = new DeadlineScheduler(time);
    ScheduledTimer timer = scheduler.schedule(Duration.ZERO, () -> { });

    scheduler.runDue();

    assertFalse(timer.cancel());
    assertTrue(timer.hasFired());
    assertFalse(timer.isCancelled());
  }

  @Test
  void failingTaskDoesNotStopLaterTasks() {
    ManualTimeSource time = new ManualTimeSource();
    DeadlineScheduler scheduler = new DeadlineScheduler(time);
    AtomicInteger runs = new AtomicInteger();

    scheduler.schedule(Duration.ofMillis(1), () -> {
      throw new IllegalStateException("boom");
    });
    scheduler.schedule(Duration.ofMillis(2), runs::incrementAndGet);

    assertEquals(2, time.advanceAndRun(scheduler, Duration.ofMillis(5)));
    assertEquals(1, runs.get());
  }

  @Test
  void closeCancelsPendingTimersAndRejectsNewOnes() {
    ManualTimeSource time = new ManualTimeSource();
    DeadlineScheduler scheduler = new DeadlineScheduler(time);
    ScheduledTimer timer = scheduler.schedule(Duration.ofSeconds(1), () -> { });

    scheduler.close();

    assertTrue(timer.isCancelled());
    assertThrows(IllegalStateException.class,
        () -> scheduler.schedule(Duration.ofSeconds(1), () -> { }));
    assertThrows(IllegalStateException.class, scheduler::start);
  }

  @Test
  void startedSchedulerFiresOnItsOwnThread() throws Exception {
    try (DeadlineScheduler scheduler = new DeadlineScheduler()) {
      assertFalse(scheduler.isRunning());
      scheduler.start();
      assertTrue(scheduler.isRunning());
      CountDownLatch fired = new CountDownLatch(1);
      scheduler.schedule(Duration.ofMillis(20), fired::countDown);
      assertTrue(fired.await(5, TimeUnit.SECONDS));
    }
  }
}
