package guardrail.session;

import guardrail.schedule.DeadlineScheduler;
import guardrail.schedule.ScheduledTimer;
import guardrail.schedule.TimeSource;
import guardrail.spi.MetricsExporter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-window session expiry.
 *
 * <p>A session expires exactly {@code duration} after it was created. Activity is recorded
 * but never moves the expiry. A warning is issued once when no more than {@code warningLead}
 * remains. Both transitions are driven by {@link DeadlineScheduler} timers and are also
 * re-checked on every query, so a late timer never makes an expired session look valid.
 *
 * <p>Expired sessions stay queryable for {@code expiredRetention} and are then removed.
 *
 * <p>Each session is guarded by its own monitor. Listener and per-session callbacks run on
 * {@code executor} after the monitor is released, never on the scheduler thread.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class SessionManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SessionManager.class.getName());

  private final DeadlineScheduler scheduler;
  private final TimeSource timeSource;
  private final Duration duration;
  private final Duration warningLead;
  private final Duration expiredRetention;
  private final SessionListener listener;
  private final MetricsExporter metrics;
  private final Executor executor;
  private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();

  private SessionManager(Builder builder) {
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.timeSource = scheduler.timeSource();
    this.duration = requirePositive(builder.duration, "duration");
    this.warningLead = requirePositive(builder.warningLead, "warningLead");
    if (warningLead.compareTo(duration) >= 0) {
      throw new IllegalArgumentException("warningLead must be shorter than duration");
    }
    Objects.requireNonNull(builder.expiredRetention, "expiredRetention");
    if (builder.expiredRetention.isNegative()) {
      throw new IllegalArgumentException("expiredRetention must be >= 0");
    }
    this.expiredRetention = builder.expiredRetention;
    this.listener = builder.listener != null ? builder.listener : SessionListener.NOOP;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.executor = builder.executor != null ? builder.executor : ForkJoinPool.commonPool();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts a session whose expiry is fixed from now.
   *
   * @throws IllegalStateException if {@code sessionId} is already known, or the scheduler has
   *     been closed
   */
  public SessionSnapshot createSession(String sessionId, String actorId) {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(actorId, "actorId");
    long nowNanos = timeSource.nanoTime();
    Session session = new Session(sessionId, actorId, nowNanos, timeSource.now());
    if (sessions.putIfAbsent(sessionId, session) != null) {
      throw new IllegalStateException("Session already exists: " + sessionId);
    }
    SessionSnapshot snapshot;
    synchronized (session) {
      // destroySession may already have removed it
      if (!session.destroyed) {
        try {
          session.warningTimer = scheduler.schedule(duration.minus(warningLead),
              () -> issueWarning(session));
          session.expiryTimer = scheduler.schedule(duration, () -> expire(session));
        } catch (IllegalStateException e) {
          cancelTimersLocked(session);
          sessions.remove(sessionId, session);
          throw e;
        }
      }
      snapshot = snapshotLocked(session, nowNanos);
    }
    logger.log(Level.FINE, "Session {0} created, expires at {1}",
        new Object[]{sessionId, snapshot.expiresAt()});
    metrics.recordActiveSessions(activeCount());
    return snapshot;
  }

  /**
   * Records activity. The expiry does not move.
   *
   * @return the updated snapshot, or empty if the session is unknown or expired
   */
  public Optional<SessionSnapshot> recordActivity(String sessionId) {
    Session session = sessions.get(sessionId);
    if (session == null || !refresh(session)) {
      return Optional.empty();
    }
    synchronized (session) {
      if (session.expired) {
        return Optional.empty();
      }
      session.lastActivity = timeSource.now();
      return Optional.of(snapshotLocked(session, timeSource.nanoTime()));
    }
  }

  /**
   * @return the current view, or empty if the session is unknown or already cleaned up
   */
  public Optional<SessionSnapshot> state(String sessionId) {
    Session session = sessions.get(sessionId);
    if (session == null) {
      return Optional.empty();
    }
    refresh(session);
    synchronized (session) {
      return Optional.of(snapshotLocked(session, timeSource.nanoTime()));
    }
  }

  /**
   * @return the snapshot of a valid session
   * @throws SessionExpiredException if the session is expired or unknown
   */
  public SessionSnapshot requireActive(String sessionId) {
    Optional<SessionSnapshot> snapshot = state(sessionId);
    if (snapshot.isEmpty()) {
      throw new SessionExpiredException(sessionId, "Session not found: " + sessionId);
    }
    if (snapshot.get().isExpired()) {
      throw new SessionExpiredException(sessionId, "Session expired: " + sessionId);
    }
    return snapshot.get();
  }

  /**
   * Expires a session now. Repeated calls are no-ops.
   *
   * @return true if this call expired the session
   */
  public boolean expireSession(String sessionId) {
    Session session = sessions.get(sessionId);
    return session != null && expire(session);
  }

  /**
   * Removes a session and cancels all of its timers. No further callbacks fire for it.
   *
   * @return true if the session existed
   */
  public boolean destroySession(String sessionId) {
    Session session = sessions.remove(sessionId);
    if (session == null) {
      return false;
    }
    synchronized (session) {
      session.destroyed = true;
      cancelTimersLocked(session);
    }
    logger.log(Level.FINE, "Session {0} destroyed", sessionId);
    metrics.recordActiveSessions(activeCount());
    return true;
  }

  /**
   * @return snapshots of every session that has not expired
   */
  public List<SessionSnapshot> activeSessions() {
    List<SessionSnapshot> active = new ArrayList<>();
    for (Session session : sessions.values()) {
      if (!refresh(session)) {
        continue;
      }
      synchronized (session) {
        if (!session.expired && !session.destroyed) {
          active.add(snapshotLocked(session, timeSource.nanoTime()));
        }
      }
    }
    return active;
  }

  /**
   * Registers a callback for this session's warning, replacing any earlier one.
   *
   * @return false if the session is unknown
   */
  public boolean onWarning(String sessionId, Consumer<SessionSnapshot> callback) {
    Session session = sessions.get(sessionId);
    if (session == null) {
      return false;
    }
    synchronized (session) {
      session.warningCallback = callback;
    }
    return true;
  }

  /**
   * Registers a callback for this session's expiry, replacing any earlier one.
   *
   * @return false if the session is unknown
   */
  public boolean onExpired(String sessionId, Consumer<SessionSnapshot> callback) {
    Session session = sessions.get(sessionId);
    if (session == null) {
      return false;
    }
    synchronized (session) {
      session.expiredCallback = callback;
    }
    return true;
  }

  public Duration duration() {
    return duration;
  }

  public Duration warningLead() {
    return warningLead;
  }

  /**
   * Applies any transition that is due but whose timer has not run yet.
   *
   * @return true if the session is still valid
   */
  private boolean refresh(Session session) {
    long nowNanos = timeSource.nanoTime();
    long remaining = session.expiresAtNanos - nowNanos;
    if (remaining <= 0) {
      expire(session);
      return false;
    }
    if (remaining <= warningLead.toNanos()) {
      issueWarning(session);
    }
    synchronized (session) {
      return !session.expired && !session.destroyed;
    }
  }

  private void issueWarning(Session session) {
    SessionSnapshot snapshot;
    Consumer<SessionSnapshot> callback;
    synchronized (session) {
      if (session.warningIssued || session.expired || session.destroyed) {
        return;
      }
      session.warningIssued = true;
      if (session.warningTimer != null) {
        session.warningTimer.cancel();
      }
      snapshot = snapshotLocked(session, timeSource.nanoTime());
      callback = session.warningCallback;
    }
    logger.log(Level.INFO, "Session {0} expires in {1}",
        new Object[]{session.sessionId, snapshot.remainingFormatted()});
    dispatch(session, () -> {
      notify(session, () -> listener.onWarning(snapshot));
      if (callback != null) {
        notify(session, () -> callback.accept(snapshot));
      }
    });
  }

  private boolean expire(Session session) {
    SessionSnapshot snapshot;
    Consumer<SessionSnapshot> callback;
    synchronized (session) {
      if (session.expired || session.destroyed) {
        return false;
      }
      session.expired = true;
      cancelTimersLocked(session);
      try {
        session.cleanupTimer = scheduler.schedule(expiredRetention,
            () -> sessions.remove(session.sessionId, session));
      } catch (IllegalStateException e) {
        sessions.remove(session.sessionId, session);
      }
      snapshot = snapshotLocked(session, timeSource.nanoTime());
      callback = session.expiredCallback;
    }
    logger.log(Level.INFO, "Session {0} expired", session.sessionId);
    metrics.incrementSessionExpired();
    metrics.recordActiveSessions(activeCount());
    dispatch(session, () -> {
      notify(session, () -> listener.onExpired(snapshot));
      if (callback != null) {
        notify(session, () -> callback.accept(snapshot));
      }
    });
    return true;
  }

  private void dispatch(Session session, Runnable calls) {
    try {
      executor.execute(calls);
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Executor rejected callbacks for session " + session.sessionId
          + "; running them inline", e);
      calls.run();
    }
  }

  private void notify(Session session, Runnable call) {
    try {
      call.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Session callback failed for " + session.sessionId, e);
    }
  }

  // Caller must hold the session monitor.
  private void cancelTimersLocked(Session session) {
    if (session.warningTimer != null) {
      session.warningTimer.cancel();
    }
    if (session.expiryTimer != null) {
      session.expiryTimer.cancel();
    }
    if (session.cleanupTimer != null) {
      session.cleanupTimer.cancel();
    }
  }

  // Caller must hold the session monitor.
  private SessionSnapshot snapshotLocked(Session session, long nowNanos) {
    long remainingNanos = session.expired ? 0L : Math.max(0L, session.expiresAtNanos - nowNanos);
    SessionState state = session.expired
        ? SessionState.EXPIRED
        : session.warningIssued ? SessionState.WARNING_ISSUED : SessionState.ACTIVE;
    boolean showWarning = remainingNanos > 0 && remainingNanos <= warningLead.toNanos();
    return new SessionSnapshot(session.sessionId, session.actorId, session.startTime,
        session.startTime.plus(duration), session.lastActivity, Duration.ofNanos(remainingNanos),
        state, showWarning);
  }

  private int activeCount() {
    int count = 0;
    for (Session session : sessions.values()) {
      synchronized (session) {
        if (!session.expired && !session.destroyed) {
          count++;
        }
      }
    }
    return count;
  }

  /**
   * Cancels every session timer and forgets all sessions. No callbacks fire.
   */
  @Override
  public void close() {
    for (String sessionId : new ArrayList<>(sessions.keySet())) {
      destroySession(sessionId);
    }
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive, got: " + value);
    }
    return value;
  }

  private final class Session {
    private final String sessionId;
    private final String actorId;
    private final long expiresAtNanos;
    private final Instant startTime;
    private Instant lastActivity;
    private boolean warningIssued;
    private boolean expired;
    private boolean destroyed;
    private ScheduledTimer warningTimer;
    private ScheduledTimer expiryTimer;
    private ScheduledTimer cleanupTimer;
    private Consumer<SessionSnapshot> warningCallback;
    private Consumer<SessionSnapshot> expiredCallback;

    private Session(String sessionId, String actorId, long startNanos, Instant startTime) {
      this.sessionId = sessionId;
      this.actorId = actorId;
      this.expiresAtNanos = startNanos + duration.toNanos();
      this.startTime = startTime;
      this.lastActivity = startTime;
    }
  }

  /** Builder for {@link SessionManager}. */
  public static final class Builder {
    private DeadlineScheduler scheduler;
    private Duration duration = Duration.ofMinutes(20);
    private Duration warningLead = Duration.ofMinutes(2);
    private Duration expiredRetention = Duration.ofMinutes(5);
    private SessionListener listener;
    private MetricsExporter metrics;
    private Executor executor;

    private Builder() {}

    /**
     * Sets the scheduler for warning, expiry and cleanup timers. Its time source is also the
     * session clock.
     *
     * <p><b>Required.</b>
     */
    public Builder scheduler(DeadlineScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Fixed session length.
     *
     * <p>Optional. Defaults to {@code 20 minutes}.
     */
    public Builder duration(Duration duration) {
      this.duration = duration;
      return this;
    }

    /**
     * How long before expiry the warning is issued.
     *
     * <p>Optional. Defaults to {@code 2 minutes}. Must be shorter than the duration.
     */
    public Builder warningLead(Duration warningLead) {
      this.warningLead = warningLead;
      return this;
    }

    /**
     * How long an expired session stays queryable before it is removed.
     *
     * <p>Optional. Defaults to {@code 5 minutes}.
     */
    public Builder expiredRetention(Duration expiredRetention) {
      this.expiredRetention = expiredRetention;
      return this;
    }

    public Builder listener(SessionListener listener) {
      this.listener = listener;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Executor for listener and per-session callbacks.
     *
     * <p>Optional. Defaults to the common pool.
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    public SessionManager build() {
      return new SessionManager(this);
    }
  }
}
