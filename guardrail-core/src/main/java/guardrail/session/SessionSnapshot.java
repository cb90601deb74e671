package guardrail.session;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable view of a session at one instant.
 *
 * @param sessionId         the session
 * @param actorId           who owns it
 * @param startTime         when it was created
 * @param expiresAt         {@code startTime + duration}; never moves
 * @param lastActivity      last recorded activity, informational only
 * @param remaining         time until expiry, zero once expired
 * @param state             lifecycle state
 * @param shouldShowWarning remaining time is positive and within the warning lead
 */
public record SessionSnapshot(
    String sessionId,
    String actorId,
    Instant startTime,
    Instant expiresAt,
    Instant lastActivity,
    Duration remaining,
    SessionState state,
    boolean shouldShowWarning) {

  public boolean isExpired() {
    return state == SessionState.EXPIRED;
  }

  public boolean isValid() {
    return !isExpired();
  }

  /**
   * Remaining time as {@code mm:ss}, e.g. {@code 01:59}.
   */
  public String remainingFormatted() {
    long totalSeconds = remaining.getSeconds();
    return String.format("%02d:%02d", totalSeconds / 60, totalSeconds % 60);
  }
}
