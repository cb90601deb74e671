package guardrail;

import guardrail.audit.AuditAction;
import guardrail.audit.AuditAlertListener;
import guardrail.audit.AuditEntry;
import guardrail.audit.AuditResource;
import guardrail.audit.AuditSink;
import guardrail.audit.AuditTrail;
import guardrail.audit.IntegrityHasher;
import guardrail.bulkhead.Bulkhead;
import guardrail.bulkhead.BulkheadConfig;
import guardrail.bulkhead.BulkheadListener;
import guardrail.bulkhead.BulkheadRegistry;
import guardrail.retry.ErrorKind;
import guardrail.retry.RetriesExhaustedException;
import guardrail.retry.RetryExecutor;
import guardrail.retry.RetryListener;
import guardrail.retry.RetryPolicy;
import guardrail.retry.ServiceException;
import guardrail.schedule.DeadlineScheduler;
import guardrail.schedule.TimeSource;
import guardrail.session.SessionExpiredException;
import guardrail.session.SessionListener;
import guardrail.session.SessionManager;
import guardrail.session.SessionSnapshot;
import guardrail.spi.MetricsExporter;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link DeadlineScheduler}, {@link BulkheadRegistry},
 * {@link RetryExecutor}, {@link AuditTrail} and {@link SessionManager} into a single
 * {@link AutoCloseable} unit.
 *
 * <p>{@link #execute(String, AsyncOperation)} retries around the bulkhead: every attempt
 * acquires its own slot and a backoff sleep never holds one. Each service name maps to a
 * {@link ServiceProfile} (or explicit limits) registered on the builder.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Guardrail guardrail = Guardrail.builder()
 *     .service("radiography-analysis", ServiceProfile.CRITICAL)
 *     .auditSink(sink)
 *     .auditSecretKey(secret)
 *     .build()) {
 *   guardrail.start();
 *   guardrail.startSession(sessionId, doctorId);
 *   guardrail.executeAudited(sessionId, "radiography-analysis",
 *       AuditEntry.builder(doctorId, AuditAction.ANALYSIS_START, AuditResource.RADIOGRAPHY_IMAGE)
 *           .build(),
 *       () -> client.analyze(image));
 * }
 * }</pre>
 */
public final class Guardrail implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Guardrail.class.getName());

  private final DeadlineScheduler scheduler;
  private final BulkheadRegistry bulkheads;
  private final RetryExecutor retryExecutor;
  private final AuditTrail auditTrail;
  private final SessionManager sessionManager;
  private final MetricsExporter metrics;
  private final RetryPolicy defaultRetryPolicy;
  private final Map<String, RetryPolicy> retryPolicies;
  private final TimeSource timeSource;

  private Guardrail(Builder builder) {
    this.timeSource = builder.timeSource != null ? builder.timeSource : TimeSource.SYSTEM;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.scheduler = new DeadlineScheduler(timeSource);
    this.defaultRetryPolicy = builder.defaultProfile.retry();
    this.retryPolicies = Map.copyOf(builder.retryPolicies);

    BulkheadRegistry.Builder registry = BulkheadRegistry.builder()
        .scheduler(scheduler)
        .defaultConfig(builder.defaultProfile.bulkhead())
        .listener(builder.bulkheadListener)
        .metrics(metrics)
        .executor(builder.executor);
    builder.bulkheadConfigs.forEach(registry::serviceConfig);
    this.bulkheads = registry.build();

    this.retryExecutor = RetryExecutor.builder()
        .scheduler(scheduler)
        .executor(builder.executor)
        .listener(builder.retryListener)
        .metrics(metrics)
        .build();

    this.auditTrail = AuditTrail.builder()
        .sink(builder.auditSink)
        .hasher(builder.auditHasher)
        .bufferCapacity(builder.auditBufferCapacity)
        .flushInterval(builder.auditFlushInterval)
        .highWaterMark(builder.auditHighWaterMark)
        .alertListener(builder.auditAlertListener)
        .metrics(metrics)
        .timeSource(timeSource)
        .build();

    SessionListener userListener = builder.sessionListener != null
        ? builder.sessionListener : SessionListener.NOOP;
    this.sessionManager = SessionManager.builder()
        .scheduler(scheduler)
        .duration(builder.sessionDuration)
        .warningLead(builder.sessionWarningLead)
        .expiredRetention(builder.sessionExpiredRetention)
        .listener(new AuditingSessionListener(userListener))
        .metrics(metrics)
        .executor(builder.executor)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the timer thread and the periodic audit flush.
   */
  public void start() {
    scheduler.start();
    auditTrail.start();
  }

  /**
   * Runs {@code operation} for {@code serviceName} with the service's retry policy.
   */
  public <T> CompletableFuture<T> execute(String serviceName, AsyncOperation<T> operation) {
    return execute(serviceName, operation, retryPolicy(serviceName));
  }

  /**
   * Runs {@code operation} with retries, each attempt admitted by the service's bulkhead.
   *
   * @param serviceName bulkhead key, also used as the retry operation name
   * @param operation   the external call
   * @param policy      retry settings for this call
   * @param <T>         the result type
   * @return the outcome; failures are the operation's own error, a
   *     {@link guardrail.bulkhead.BulkheadRejectedException}, or a
   *     {@link RetriesExhaustedException}
   */
  public <T> CompletableFuture<T> execute(String serviceName, AsyncOperation<T> operation,
      RetryPolicy policy) {
    Objects.requireNonNull(operation, "operation");
    Bulkhead bulkhead = bulkheads.bulkhead(serviceName);
    return retryExecutor.withRetry(serviceName, () -> bulkhead.execute(operation), policy);
  }

  /**
   * Checks the session, runs the operation like {@link #execute(String, AsyncOperation)}, and
   * records the outcome in the audit trail.
   *
   * <p>An expired or unknown session fails fast with {@link SessionExpiredException} and is
   * audited as {@link AuditAction#UNAUTHORIZED_ACCESS}; the operation is not attempted.
   *
   * @param sessionId   the caller's session
   * @param serviceName bulkhead key
   * @param template    audit details; session, outcome and duration are filled in here
   * @param operation   the external call
   * @param <T>         the result type
   * @return the outcome, completing after the audit event has been logged
   */
  public <T> CompletableFuture<T> executeAudited(String sessionId, String serviceName,
      AuditEntry template, AsyncOperation<T> operation) {
    Objects.requireNonNull(template, "template");
    try {
      sessionManager.requireActive(sessionId);
    } catch (SessionExpiredException e) {
      auditTrail.logEvent(AuditEntry.builder(template.actorId(),
              AuditAction.UNAUTHORIZED_ACCESS, template.resource())
          .sessionId(sessionId)
          .resourceId(template.resourceId())
          .outcomeCode(401)
          .errorMessage(e.getMessage())
          .build());
      return CompletableFuture.failedFuture(e);
    }
    sessionManager.recordActivity(sessionId);

    long startNanos = timeSource.nanoTime();
    return execute(serviceName, operation).whenComplete((value, error) -> {
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(timeSource.nanoTime() - startNanos);
      AuditEntry.Builder entry = template.toBuilder()
          .sessionId(sessionId)
          .durationMs(elapsedMs);
      if (error == null) {
        entry.outcomeCode(200);
      } else {
        Throwable cause = ErrorKind.unwrap(error);
        entry.outcomeCode(outcomeCodeOf(cause)).errorMessage(cause.getMessage());
      }
      try {
        auditTrail.logEvent(entry.build());
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to audit " + template.action() + " for session "
            + sessionId, e);
      }
    });
  }

  /**
   * Creates a session and audits {@link AuditAction#SESSION_START}.
   */
  public SessionSnapshot startSession(String sessionId, String actorId) {
    SessionSnapshot snapshot = sessionManager.createSession(sessionId, actorId);
    auditTrail.logEvent(AuditEntry.builder(actorId, AuditAction.SESSION_START,
            AuditResource.MEDICAL_SESSION)
        .sessionId(sessionId)
        .build());
    return snapshot;
  }

  /**
   * Destroys a session and audits {@link AuditAction#SESSION_END}.
   *
   * @return false if the session was unknown
   */
  public boolean endSession(String sessionId) {
    Optional<SessionSnapshot> snapshot = sessionManager.state(sessionId);
    if (!sessionManager.destroySession(sessionId)) {
      return false;
    }
    snapshot.ifPresent(s -> auditTrail.logEvent(AuditEntry.builder(s.actorId(),
            AuditAction.SESSION_END, AuditResource.MEDICAL_SESSION)
        .sessionId(sessionId)
        .build()));
    return true;
  }

  /**
   * Translates a failure from {@link #execute} into a message for end users.
   */
  public static String describeFailure(Throwable error) {
    return ServiceException.userMessage(ErrorKind.of(error));
  }

  /**
   * HTTP-like outcome code used when auditing a failure.
   */
  static int outcomeCodeOf(Throwable error) {
    Throwable t = ErrorKind.unwrap(error);
    if (t instanceof RetriesExhaustedException && t.getCause() != null) {
      t = t.getCause();
    }
    if (t instanceof ServiceException se && se.status() > 0) {
      return se.status();
    }
    return switch (ErrorKind.of(t)) {
      case VALIDATION, CLIENT -> 400;
      case AUTHORIZATION -> t instanceof SessionExpiredException ? 401 : 403;
      case NOT_FOUND -> 404;
      case LOCK_CONTENTION -> 409;
      case RATE_LIMITED -> 429;
      case NETWORK -> 502;
      case REJECTED -> 503;
      case TIMEOUT -> 504;
      case SERVER, UNKNOWN -> 500;
    };
  }

  public BulkheadRegistry bulkheads() {
    return bulkheads;
  }

  public RetryExecutor retryExecutor() {
    return retryExecutor;
  }

  public AuditTrail auditTrail() {
    return auditTrail;
  }

  public SessionManager sessions() {
    return sessionManager;
  }

  public DeadlineScheduler scheduler() {
    return scheduler;
  }

  public RetryPolicy retryPolicy(String serviceName) {
    return retryPolicies.getOrDefault(serviceName, defaultRetryPolicy);
  }

  /**
   * Shuts down components in order: sessions, bulkhead queues, scheduler, audit trail (with a
   * final flush), and the metrics exporter if it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      sessionManager.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      bulkheads.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      scheduler.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      auditTrail.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private final class AuditingSessionListener implements SessionListener {
    private final SessionListener delegate;

    private AuditingSessionListener(SessionListener delegate) {
      this.delegate = delegate;
    }

    @Override
    public void onWarning(SessionSnapshot session) {
      delegate.onWarning(session);
    }

    @Override
    public void onExpired(SessionSnapshot session) {
      try {
        auditTrail.logEvent(AuditEntry.builder(session.actorId(), AuditAction.SESSION_TIMEOUT,
                AuditResource.MEDICAL_SESSION)
            .sessionId(session.sessionId())
            .build());
      } catch (IllegalStateException e) {
        logger.log(Level.WARNING, "Session timeout not audited: " + session.sessionId(), e);
      }
      delegate.onExpired(session);
    }
  }

  /** Builder for {@link Guardrail}. */
  public static final class Builder {
    private TimeSource timeSource;
    private MetricsExporter metrics;
    private ServiceProfile defaultProfile = ServiceProfile.NORMAL;
    private final Map<String, BulkheadConfig> bulkheadConfigs = new HashMap<>();
    private final Map<String, RetryPolicy> retryPolicies = new HashMap<>();
    private BulkheadListener bulkheadListener;
    private RetryListener retryListener;
    private Executor executor;
    private AuditSink auditSink;
    private IntegrityHasher auditHasher;
    private int auditBufferCapacity = 100;
    private Duration auditFlushInterval = Duration.ofSeconds(10);
    private int auditHighWaterMark = 1000;
    private AuditAlertListener auditAlertListener;
    private Duration sessionDuration = Duration.ofMinutes(20);
    private Duration sessionWarningLead = Duration.ofMinutes(2);
    private Duration sessionExpiredRetention = Duration.ofMinutes(5);
    private SessionListener sessionListener;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Clock for all timers and timestamps. Optional. Defaults to {@link TimeSource#SYSTEM}.
     */
    public Builder timeSource(TimeSource timeSource) {
      this.timeSource = timeSource;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Profile for services without an explicit entry.
     *
     * <p>Optional. Defaults to {@link ServiceProfile#NORMAL}.
     */
    public Builder defaultProfile(ServiceProfile defaultProfile) {
      this.defaultProfile = Objects.requireNonNull(defaultProfile, "defaultProfile");
      return this;
    }

    public Builder service(String serviceName, ServiceProfile profile) {
      Objects.requireNonNull(profile, "profile");
      return service(serviceName, profile.bulkhead(), profile.retry());
    }

    public Builder service(String serviceName, BulkheadConfig bulkhead,
        RetryPolicy retry) {
      Objects.requireNonNull(serviceName, "serviceName");
      bulkheadConfigs.put(serviceName, Objects.requireNonNull(bulkhead, "bulkhead"));
      retryPolicies.put(serviceName, Objects.requireNonNull(retry, "retry"));
      return this;
    }

    public Builder bulkheadListener(BulkheadListener bulkheadListener) {
      this.bulkheadListener = bulkheadListener;
      return this;
    }

    public Builder retryListener(RetryListener retryListener) {
      this.retryListener = retryListener;
      return this;
    }

    /**
     * Executor for everything a timer hands off: attempts after a backoff delay, failing callers
     * whose bulkhead wait timed out, and session warning and expiry callbacks (including their
     * audit events).
     *
     * <p>Optional. Defaults to the common pool.
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    public Builder auditSink(AuditSink auditSink) {
      this.auditSink = auditSink;
      return this;
    }

    /**
     * Secret for audit integrity hashes and subject pseudonyms.
     *
     * <p>Optional. A random key is generated, with a warning, when null or blank.
     */
    public Builder auditSecretKey(String secret) {
      this.auditHasher = secret == null || secret.isBlank() ? null : IntegrityHasher.fromSecret(secret);
      return this;
    }

    public Builder auditHasher(IntegrityHasher auditHasher) {
      this.auditHasher = auditHasher;
      return this;
    }

    public Builder auditBufferCapacity(int auditBufferCapacity) {
      this.auditBufferCapacity = auditBufferCapacity;
      return this;
    }

    public Builder auditFlushInterval(Duration auditFlushInterval) {
      this.auditFlushInterval = auditFlushInterval;
      return this;
    }

    public Builder auditHighWaterMark(int auditHighWaterMark) {
      this.auditHighWaterMark = auditHighWaterMark;
      return this;
    }

    public Builder auditAlertListener(AuditAlertListener auditAlertListener) {
      this.auditAlertListener = auditAlertListener;
      return this;
    }

    public Builder sessionDuration(Duration sessionDuration) {
      this.sessionDuration = sessionDuration;
      return this;
    }

    public Builder sessionWarningLead(Duration sessionWarningLead) {
      this.sessionWarningLead = sessionWarningLead;
      return this;
    }

    public Builder sessionExpiredRetention(Duration sessionExpiredRetention) {
      this.sessionExpiredRetention = sessionExpiredRetention;
      return this;
    }

    public Builder sessionListener(SessionListener sessionListener) {
      this.sessionListener = sessionListener;
      return this;
    }

    /**
     * Builds the composite. Call {@link Guardrail#start()} to start its timer thread and the
     * periodic audit flush.
     *
     * @throws IllegalStateException    if build() was already called
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public Guardrail build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new Guardrail(this);
    }
  }
}
