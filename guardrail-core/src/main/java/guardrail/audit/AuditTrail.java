package guardrail.audit;

import com.github.f4b6a3.ulid.UlidCreator;
import guardrail.schedule.TimeSource;
import guardrail.spi.MetricsExporter;
import guardrail.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffered, integrity-signed audit log.
 *
 * <p>{@link #logEvent(AuditEntry)} derives risk, compliance flags and data classification,
 * signs the event with HMAC-SHA256 and appends it to an in-memory buffer. The buffer is
 * flushed to the {@link AuditSink}:
 * <ul>
 *   <li>synchronously, when the event is {@link RiskLevel#CRITICAL};</li>
 *   <li>synchronously, when the buffer reaches {@code bufferCapacity};</li>
 *   <li>periodically, every {@code flushInterval}, once {@link #start()} has been called;</li>
 *   <li>on {@link #close()}.</li>
 * </ul>
 *
 * <p>A failed flush puts the batch back at the front of the buffer in its original order.
 * Events are never dropped; once {@code highWaterMark} events are waiting, every further
 * append logs at SEVERE and notifies the {@link AuditAlertListener}.
 *
 * <p>Flushes are serialized. Appends only contend on the buffer lock and never wait for the
 * sink unless they trigger a synchronous flush themselves.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class AuditTrail implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AuditTrail.class.getName());

  private final AuditSink sink;
  private final IntegrityHasher hasher;
  private final int bufferCapacity;
  private final Duration flushInterval;
  private final int highWaterMark;
  private final AuditAlertListener alertListener;
  private final MetricsExporter metrics;
  private final TimeSource timeSource;

  private final ReentrantLock bufferLock = new ReentrantLock();
  private final ReentrantLock flushLock = new ReentrantLock();
  private List<AuditEvent> buffer = new ArrayList<>();

  private ScheduledExecutorService flusher;
  private volatile ScheduledFuture<?> flushTask;
  private volatile boolean closed;

  private AuditTrail(Builder builder) {
    if (builder.bufferCapacity <= 0) {
      throw new IllegalArgumentException("bufferCapacity must be > 0, got: " + builder.bufferCapacity);
    }
    if (builder.flushInterval == null || builder.flushInterval.isZero()
        || builder.flushInterval.isNegative()) {
      throw new IllegalArgumentException("flushInterval must be positive");
    }
    if (builder.highWaterMark < builder.bufferCapacity) {
      throw new IllegalArgumentException("highWaterMark must be >= bufferCapacity, got: "
          + builder.highWaterMark);
    }
    this.sink = builder.sink != null ? builder.sink : new LoggingAuditSink();
    this.hasher = builder.hasher != null ? builder.hasher : IntegrityHasher.withGeneratedKey();
    this.bufferCapacity = builder.bufferCapacity;
    this.flushInterval = builder.flushInterval;
    this.highWaterMark = builder.highWaterMark;
    this.alertListener = builder.alertListener != null
        ? builder.alertListener : AuditAlertListener.NOOP;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.timeSource = builder.timeSource != null ? builder.timeSource : TimeSource.SYSTEM;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the periodic flush. Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if the trail has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("AuditTrail has been closed");
    }
    if (flushTask != null) {
      return;
    }
    flusher = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("guardrail-audit-flush-"));
    long intervalMs = flushInterval.toMillis();
    flushTask = flusher.scheduleWithFixedDelay(
        this::periodicFlush, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Records an operation.
   *
   * @param entry what happened
   * @return the signed event, already buffered (and flushed, if it was critical)
   * @throws IllegalStateException if the trail has been closed
   */
  public AuditEvent logEvent(AuditEntry entry) {
    return append(entry, null);
  }

  /**
   * Records a correction of an earlier event. The original stays untouched; the new event
   * references it through {@link AuditEvent#correctsEventId()}.
   */
  public AuditEvent logCorrection(AuditEvent original, AuditEntry correction) {
    Objects.requireNonNull(original, "original");
    return append(correction, original.id());
  }

  /**
   * Records access to a data subject's record.
   *
   * @param actorId      who accessed the record
   * @param rawSubjectId the subject's identifier; hashed before use
   * @param sessionId    the actor's session
   * @param action       usually one of the {@code PATIENT_*} actions
   */
  public AuditEvent logSubjectAccess(String actorId, String rawSubjectId, String sessionId,
      AuditAction action) {
    String subjectHash = hasher.hashSubject(rawSubjectId);
    return logEvent(AuditEntry.builder(actorId, action, AuditResource.PATIENT_DATA)
        .sessionId(sessionId)
        .subjectHash(subjectHash)
        .resourceId(subjectHash)
        .context(Map.of("dataType", "patient_demographics"))
        .build());
  }

  private AuditEvent append(AuditEntry entry, UUID correctsEventId) {
    Objects.requireNonNull(entry, "entry");
    if (closed) {
      throw new IllegalStateException("AuditTrail has been closed");
    }
    AuditEvent event = sign(entry, correctsEventId);

    int buffered;
    bufferLock.lock();
    try {
      // close() flips the flag under this lock before its final flush
      if (closed) {
        throw new IllegalStateException("AuditTrail has been closed");
      }
      buffer.add(event);
      buffered = buffer.size();
    } finally {
      bufferLock.unlock();
    }
    metrics.incrementAuditEvent(event.riskLevel());
    metrics.recordAuditBufferSize(buffered);

    if (buffered >= highWaterMark) {
      logger.log(Level.SEVERE, "Audit buffer at {0} events (high water mark {1}); sink is not keeping up",
          new Object[]{buffered, highWaterMark});
      try {
        alertListener.onBufferHighWater(buffered, highWaterMark);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "AuditAlertListener failed", e);
      }
    }
    if (event.riskLevel().requiresReview()) {
      logger.log(Level.WARNING, "High risk audit event id={0} action={1} resource={2} actor={3} risk={4}",
          new Object[]{event.id(), event.action().wireName(), event.resource().wireName(),
              anonymizeActorId(event.actorId()), event.riskLevel()});
    }
    if (event.riskLevel() == RiskLevel.CRITICAL || buffered >= bufferCapacity) {
      flush();
    }
    return event;
  }

  private AuditEvent sign(AuditEntry entry, UUID correctsEventId) {
    UUID id = UlidCreator.getMonotonicUlid().toUuid();
    Instant timestamp = timeSource.now();
    String subjectHash = entry.rawSubjectId() != null
        ? hasher.hashSubject(entry.rawSubjectId())
        : entry.subjectHash();
    boolean hasSubject = subjectHash != null;
    RiskLevel risk = entry.riskOverride() != null
        ? entry.riskOverride()
        : entry.action().riskFor(entry.outcomeCode());
    Set<ComplianceFlag> flags = ComplianceFlag.derive(entry.action(), hasSubject, risk);
    DataClassification classification = DataClassification.classify(entry.action(), hasSubject);

    String canonical = AuditEvent.canonicalForm(id, timestamp, entry.actorId(),
        entry.sessionId(), subjectHash, entry.action(), entry.resource(), entry.resourceId(),
        entry.outcomeCode(), risk, correctsEventId);
    return new AuditEvent(id, timestamp, entry.actorId(), entry.sessionId(), subjectHash,
        entry.action(), entry.resource(), entry.resourceId(), entry.outcomeCode(), risk, flags,
        classification, entry.ipAddress(), entry.durationMs(), entry.errorMessage(),
        entry.context(), correctsEventId, hasher.sign(canonical));
  }

  /**
   * Recomputes the integrity hash of {@code event} with this trail's key.
   *
   * @return true if the event is unchanged since it was signed
   */
  public boolean verify(AuditEvent event) {
    Objects.requireNonNull(event, "event");
    return hasher.verify(event.canonicalForm(), event.integrityHash());
  }

  /**
   * Pseudonymizes a subject identifier with this trail's key.
   */
  public String hashSubject(String rawSubjectId) {
    return hasher.hashSubject(rawSubjectId);
  }

  /**
   * Writes every buffered event to the sink as one batch.
   *
   * <p>On failure the batch is re-buffered ahead of anything appended meanwhile.
   *
   * @return the number of events written, 0 if the buffer was empty or the sink failed
   */
  public int flush() {
    flushLock.lock();
    try {
      List<AuditEvent> batch;
      bufferLock.lock();
      try {
        if (buffer.isEmpty()) {
          return 0;
        }
        batch = buffer;
        buffer = new ArrayList<>();
      } finally {
        bufferLock.unlock();
      }

      try {
        sink.appendBatch(Collections.unmodifiableList(batch));
        metrics.recordAuditBufferSize(bufferedCount());
        return batch.size();
      } catch (AuditSinkException | RuntimeException e) {
        int buffered;
        bufferLock.lock();
        try {
          batch.addAll(buffer);
          buffer = batch;
          buffered = buffer.size();
        } finally {
          bufferLock.unlock();
        }
        metrics.incrementAuditFlushFailure();
        metrics.recordAuditBufferSize(buffered);
        logger.log(Level.SEVERE, "Failed to flush " + batch.size()
            + " audit events; re-buffered (" + buffered + " waiting)", e);
        try {
          alertListener.onFlushFailure(batch.size(), e);
        } catch (RuntimeException le) {
          logger.log(Level.WARNING, "AuditAlertListener failed", le);
        }
        return 0;
      }
    } finally {
      flushLock.unlock();
    }
  }

  private void periodicFlush() {
    try {
      flush();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Periodic audit flush failed", t);
    }
  }

  /**
   * @return events appended but not yet accepted by the sink
   */
  public int bufferedCount() {
    bufferLock.lock();
    try {
      return buffer.size();
    } finally {
      bufferLock.unlock();
    }
  }

  public int bufferCapacity() {
    return bufferCapacity;
  }

  public int highWaterMark() {
    return highWaterMark;
  }

  /**
   * Stops the periodic flush and makes a final flush attempt. Events the sink still refuses
   * are reported at SEVERE.
   */
  @Override
  public synchronized void close() {
    bufferLock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
    } finally {
      bufferLock.unlock();
    }
    if (flushTask != null) {
      flushTask.cancel(false);
      flushTask = null;
    }
    if (flusher != null) {
      flusher.shutdown();
      try {
        if (!flusher.awaitTermination(5, TimeUnit.SECONDS)) {
          flusher.shutdownNow();
        }
      } catch (InterruptedException e) {
        flusher.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    flush();
    int remaining = bufferedCount();
    if (remaining > 0) {
      logger.log(Level.SEVERE, "AuditTrail closed with {0} unflushed events", remaining);
    }
  }

  static String anonymizeActorId(String actorId) {
    int len = actorId.length();
    if (len <= 4) {
      return "*".repeat(len);
    }
    return actorId.substring(0, 2) + "*".repeat(len - 4) + actorId.substring(len - 2);
  }

  /** Builder for {@link AuditTrail}. */
  public static final class Builder {
    private AuditSink sink;
    private IntegrityHasher hasher;
    private int bufferCapacity = 100;
    private Duration flushInterval = Duration.ofSeconds(10);
    private int highWaterMark = 1000;
    private AuditAlertListener alertListener;
    private MetricsExporter metrics;
    private TimeSource timeSource;

    private Builder() {}

    /**
     * Sets the destination for flushed batches.
     *
     * <p>Optional. Defaults to {@link LoggingAuditSink}.
     */
    public Builder sink(AuditSink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Sets the signing key holder.
     *
     * <p>Optional. Defaults to a random key, with a warning logged.
     */
    public Builder hasher(IntegrityHasher hasher) {
      this.hasher = hasher;
      return this;
    }

    /**
     * Shorthand for {@code hasher(IntegrityHasher.fromSecret(secret))}. A null or blank secret
     * keeps the default.
     */
    public Builder secretKey(String secret) {
      this.hasher = secret == null || secret.isBlank() ? null : IntegrityHasher.fromSecret(secret);
      return this;
    }

    /**
     * Buffered events that trigger a synchronous flush.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     */
    public Builder bufferCapacity(int bufferCapacity) {
      this.bufferCapacity = bufferCapacity;
      return this;
    }

    /**
     * Optional. Defaults to {@code 10s}. Must be positive.
     */
    public Builder flushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
      return this;
    }

    /**
     * Buffered events at which the alert fires.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &ge; bufferCapacity.
     */
    public Builder highWaterMark(int highWaterMark) {
      this.highWaterMark = highWaterMark;
      return this;
    }

    public Builder alertListener(AuditAlertListener alertListener) {
      this.alertListener = alertListener;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Source of event timestamps. Optional. Defaults to {@link TimeSource#SYSTEM}.
     */
    public Builder timeSource(TimeSource timeSource) {
      this.timeSource = timeSource;
      return this;
    }

    /**
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public AuditTrail build() {
      return new AuditTrail(this);
    }
  }
}
