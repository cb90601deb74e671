package guardrail.session;

/**
 * Lifecycle of a fixed-window session. Transitions only move forward.
 */
public enum SessionState {
  ACTIVE,
  /** Less than the warning lead remains; the warning has been delivered. */
  WARNING_ISSUED,
  EXPIRED
}
