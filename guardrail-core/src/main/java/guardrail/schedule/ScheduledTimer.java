package guardrail.schedule;

/**
 * Handle for a one-shot deadline registered with a {@link DeadlineScheduler}.
 */
public interface ScheduledTimer {

  /**
   * Cancels the timer. Safe to call any number of times, including after it fired.
   *
   * @return {@code true} if this call prevented the task from running
   */
  boolean cancel();

  /**
   * @return {@code true} once the task has been handed to its thread for execution
   */
  boolean hasFired();

  /**
   * @return {@code true} if the timer was cancelled before it fired
   */
  boolean isCancelled();
}
