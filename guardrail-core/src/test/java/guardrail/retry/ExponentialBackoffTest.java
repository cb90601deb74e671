package guardrail.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffTest {

  @Test
  void delayDoublesUntilCap() {
    ExponentialBackoff backoff = new ExponentialBackoff(200, 3000, 0);

    assertEquals(200, backoff.computeDelayMs(0));
    assertEquals(400, backoff.computeDelayMs(1));
    assertEquals(800, backoff.computeDelayMs(2));
    assertEquals(1600, backoff.computeDelayMs(3));
    assertEquals(3000, backoff.computeDelayMs(4));
    assertEquals(3000, backoff.computeDelayMs(30));
  }

  @Test
  void jitterStaysWithinBounds() {
    ExponentialBackoff backoff = new ExponentialBackoff(100, 5000, 50);
    RandomGenerator random = new SplittableRandom(42);

    for (int k = 0; k < 10; k++) {
      long floor = Math.min(100L << k, 5000L);
      for (int i = 0; i < 200; i++) {
        long delay = backoff.computeDelayMs(k, random);
        assertTrue(delay >= floor, "delay " + delay + " below " + floor);
        assertTrue(delay <= floor + 50, "delay " + delay + " above " + (floor + 50));
      }
    }
  }

  @Test
  void jitterCanReachItsUpperBound() {
    ExponentialBackoff backoff = new ExponentialBackoff(100, 100, 1);
    RandomGenerator random = new SplittableRandom(7);
    boolean sawLow = false;
    boolean sawHigh = false;

    for (int i = 0; i < 100; i++) {
      long delay = backoff.computeDelayMs(0, random);
      sawLow |= delay == 100;
      sawHigh |= delay == 101;
    }

    assertTrue(sawLow);
    assertTrue(sawHigh);
  }

  @Test
  void hugeIndexDoesNotOverflow() {
    ExponentialBackoff backoff = new ExponentialBackoff(1, Long.MAX_VALUE / 4, 0);

    assertEquals(Long.MAX_VALUE / 4, backoff.exponentialDelayMs(100));
    assertEquals(Long.MAX_VALUE / 4, backoff.exponentialDelayMs(62));
  }

  @Test
  void negativeIndexIsRejected() {
    ExponentialBackoff backoff = new ExponentialBackoff(100, 1000, 0);
    assertThrows(IllegalArgumentException.class, () -> backoff.computeDelayMs(-1));
  }

  @Test
  void constructorValidatesArguments() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(0, 1000, 0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(500, 100, 0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(100, 1000, -1));
  }

  @Test
  void durationConstructorConvertsToMillis() {
    ExponentialBackoff backoff = new ExponentialBackoff(
        Duration.ofMillis(250), Duration.ofSeconds(2), Duration.ofMillis(10));

    assertEquals(250, backoff.baseDelayMs());
    assertEquals(2000, backoff.maxDelayMs());
    assertEquals(10, backoff.jitterMaxMs());
  }
}
