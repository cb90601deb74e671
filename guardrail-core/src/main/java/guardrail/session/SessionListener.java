package guardrail.session;

/**
 * Receives warning and expiry notifications for every session of a {@link SessionManager}.
 *
 * <p>Each callback fires at most once per session, outside any session lock, on the thread
 * that observed the transition (the timer thread or a caller querying the session).
 */
public interface SessionListener {

  SessionListener NOOP = new SessionListener() {
  };

  default void onWarning(SessionSnapshot session) {
  }

  default void onExpired(SessionSnapshot session) {
  }
}
