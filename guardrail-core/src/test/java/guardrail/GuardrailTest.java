package guardrail;

import guardrail.audit.AuditAction;
import guardrail.audit.AuditEntry;
import guardrail.audit.AuditEvent;
import guardrail.audit.AuditResource;
import guardrail.audit.AuditSink;
import guardrail.bulkhead.AdmissionTimeoutException;
import guardrail.bulkhead.BulkheadConfig;
import guardrail.bulkhead.QueueFullException;
import guardrail.retry.ExponentialBackoff;
import guardrail.retry.RetriesExhaustedException;
import guardrail.retry.RetryPolicy;
import guardrail.retry.ServiceException;
import guardrail.schedule.ManualTimeSource;
import guardrail.session.SessionExpiredException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class GuardrailTest {
  private static final RetryPolicy FAST = RetryPolicy.builder()
      .maxAttempts(3)
      .backoff(new ExponentialBackoff(100, 1000, 0))
      .build();

  private ManualTimeSource time;
  private CollectingSink sink;
  private Guardrail guardrail;

  @BeforeEach
  void setUp() {
    time = new ManualTimeSource();
    sink = new CollectingSink();
    guardrail = Guardrail.builder()
        .timeSource(time)
        .executor(Runnable::run)
        .service("pacs", BulkheadConfig.of(1, 0, 1000), FAST)
        .service("radiography-analysis", ServiceProfile.CRITICAL)
        .auditSink(sink)
        .auditSecretKey("secret")
        .auditBufferCapacity(1)
        .build();
  }

  @AfterEach
  void tearDown() {
    guardrail.close();
  }

  private void advance(Duration duration) {
    time.advanceAndRun(guardrail.scheduler(), duration);
  }

  // ── Execute ───────────────────────────────────────────────────

  @Test
  void profilesConfigureBulkheadAndRetry() {
    assertEquals(BulkheadConfig.of(10, 50, 5000),
        guardrail.bulkheads().bulkhead("radiography-analysis").config());
    assertSame(RetryPolicy.CRITICAL, guardrail.retryPolicy("radiography-analysis"));
    assertSame(FAST, guardrail.retryPolicy("pacs"));
    assertSame(RetryPolicy.NORMAL, guardrail.retryPolicy("unregistered"));
    assertEquals(ServiceProfile.NORMAL.bulkhead(),
        guardrail.bulkheads().bulkhead("unregistered").config());
  }

  @Test
  void backoffDoesNotHoldABulkheadSlot() {
    AtomicInteger calls = new AtomicInteger();
    CompletableFuture<String> retried = guardrail.execute("pacs", () -> {
      if (calls.incrementAndGet() == 1) {
        return CompletableFuture.failedFuture(ServiceException.ofStatus(503, "busy"));
      }
      return CompletableFuture.completedFuture("stored");
    });

    assertEquals(0, guardrail.bulkheads().bulkhead("pacs").activeCount());
    CompletableFuture<String> other = guardrail.execute("pacs",
        () -> CompletableFuture.completedFuture("other"));
    assertEquals("other", other.join());

    advance(Duration.ofMillis(100));
    assertEquals("stored", retried.join());
    assertEquals(3, guardrail.bulkheads().bulkhead("pacs").stats().totalExecuted());
  }

  @Test
  void bulkheadRejectionIsNotRetried() {
    CompletableFuture<Object> holder = new CompletableFuture<>();
    guardrail.execute("pacs", () -> holder);

    CompletableFuture<Object> rejected = guardrail.execute("pacs",
        () -> CompletableFuture.completedFuture("never"));

    ExecutionException e = assertThrows(ExecutionException.class, rejected::get);
    assertInstanceOf(QueueFullException.class, e.getCause());
    assertEquals(0, guardrail.scheduler().pendingCount());
    assertEquals("The system is busy. Please try again in a few moments.",
        Guardrail.describeFailure(e));
  }

  @Test
  void exhaustedRetriesReportLastError() {
    CompletableFuture<Object> result = guardrail.execute("pacs",
        () -> CompletableFuture.failedFuture(ServiceException.ofNetworkCode("ECONNRESET", "reset")));
    advance(Duration.ofMillis(100));
    advance(Duration.ofMillis(200));

    ExecutionException e = assertThrows(ExecutionException.class, result::get);
    RetriesExhaustedException exhausted =
        assertInstanceOf(RetriesExhaustedException.class, e.getCause());
    assertEquals(3, exhausted.attempts());
    assertEquals(502, Guardrail.outcomeCodeOf(exhausted));
  }

  // ── Audited execution ─────────────────────────────────────────

  @Test
  void auditedSuccessIsLoggedWithSessionAndDuration() throws Exception {
    guardrail.startSession("s1", "dr.house");
    CompletableFuture<String> gate = new CompletableFuture<>();

    CompletableFuture<String> result = guardrail.executeAudited("s1", "radiography-analysis",
        AuditEntry.builder("dr.house", AuditAction.ANALYSIS_START, AuditResource.RADIOGRAPHY_IMAGE)
            .resourceId("img-7")
            .build(),
        () -> gate);
    time.advance(Duration.ofMillis(1500));
    gate.complete("analysis-id");

    assertEquals("analysis-id", result.get());
    AuditEvent event = sink.last(AuditAction.ANALYSIS_START);
    assertEquals("s1", event.sessionId());
    assertEquals(200, event.outcomeCode());
    assertEquals(Long.valueOf(1500), event.durationMs());
    assertEquals("img-7", event.resourceId());
    assertTrue(guardrail.auditTrail().verify(event));
  }

  @Test
  void auditedFailureRecordsOutcomeCode() {
    guardrail.startSession("s1", "dr.house");

    CompletableFuture<Object> result = guardrail.executeAudited("s1", "pacs",
        AuditEntry.builder("dr.house", AuditAction.PATIENT_UPDATE, AuditResource.PATIENT_DATA)
            .build(),
        () -> CompletableFuture.failedFuture(ServiceException.validation("invalid national id")));

    ExecutionException e = assertThrows(ExecutionException.class, result::get);
    assertInstanceOf(ServiceException.class, e.getCause());
    AuditEvent event = sink.last(AuditAction.PATIENT_UPDATE);
    assertEquals(400, event.outcomeCode());
    assertEquals("invalid national id", event.errorMessage());
  }

  @Test
  void expiredSessionIsRejectedAndAudited() {
    guardrail.startSession("s1", "dr.house");
    advance(Duration.ofMinutes(20));
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<Object> result = guardrail.executeAudited("s1", "pacs",
        AuditEntry.builder("dr.house", AuditAction.PATIENT_VIEW, AuditResource.PATIENT_DATA)
            .build(),
        () -> {
          calls.incrementAndGet();
          return CompletableFuture.completedFuture(null);
        });

    ExecutionException e = assertThrows(ExecutionException.class, result::get);
    assertInstanceOf(SessionExpiredException.class, e.getCause());
    assertEquals(0, calls.get());
    AuditEvent event = sink.last(AuditAction.UNAUTHORIZED_ACCESS);
    assertEquals(401, event.outcomeCode());
    assertEquals("s1", event.sessionId());
  }

  @Test
  void slowAuditSinkDoesNotStallTimeoutsOfOtherServices() throws Exception {
    CountDownLatch exporting = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AuditSink slowArchive = batch -> {
      for (AuditEvent event : batch) {
        if (event.action() == AuditAction.DATA_EXPORT) {
          exporting.countDown();
          try {
            release.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
        }
      }
    };
    ExecutorService pool = Executors.newCachedThreadPool();
    Guardrail live = Guardrail.builder()
        .executor(pool)
        .service("export", BulkheadConfig.of(1, 1, 100), FAST)
        .service("lab", BulkheadConfig.of(1, 1, 300), FAST)
        .auditSink(slowArchive)
        .auditSecretKey("secret")
        .build();
    try {
      live.start();
      live.execute("export", CompletableFuture::new);
      live.startSession("s1", "dr.house");
      CompletableFuture<Object> export = live.executeAudited("s1", "export",
          AuditEntry.builder("dr.house", AuditAction.DATA_EXPORT, AuditResource.PATIENT_DATA)
              .build(),
          CompletableFuture::new);
      assertTrue(exporting.await(5, TimeUnit.SECONDS));

      live.execute("lab", CompletableFuture::new);
      CompletableFuture<Object> lab = live.execute("lab", CompletableFuture::new);

      ExecutionException e = assertThrows(ExecutionException.class,
          () -> lab.get(2, TimeUnit.SECONDS));
      assertInstanceOf(AdmissionTimeoutException.class, e.getCause());
      assertFalse(export.isDone());
    } finally {
      release.countDown();
      live.close();
      pool.shutdownNow();
    }
  }

  // ── Session lifecycle auditing ────────────────────────────────

  @Test
  void sessionLifecycleIsAudited() {
    guardrail.startSession("s1", "dr.house");
    guardrail.startSession("s2", "dr.wilson");

    assertTrue(guardrail.endSession("s1"));
    assertFalse(guardrail.endSession("s1"));
    advance(Duration.ofMinutes(20));

    assertEquals(List.of(AuditAction.SESSION_START, AuditAction.SESSION_START,
        AuditAction.SESSION_END, AuditAction.SESSION_TIMEOUT), sink.actions());
    assertEquals("dr.wilson", sink.last(AuditAction.SESSION_TIMEOUT).actorId());
  }

  // ── Failure mapping ───────────────────────────────────────────

  @Test
  void outcomeCodes() {
    assertEquals(503, Guardrail.outcomeCodeOf(ServiceException.ofStatus(503, "x")));
    assertEquals(404, Guardrail.outcomeCodeOf(ServiceException.notFound("x")));
    assertEquals(409, Guardrail.outcomeCodeOf(ServiceException.ofStatus(409, "x")));
    assertEquals(409, Guardrail.outcomeCodeOf(ServiceException.lockContention("deadlock", null)));
    assertEquals(401, Guardrail.outcomeCodeOf(new SessionExpiredException("s", "x")));
    assertEquals(403, Guardrail.outcomeCodeOf(ServiceException.authorization("x")));
    assertEquals(503, Guardrail.outcomeCodeOf(new QueueFullException("svc", 1, 1)));
    assertEquals(504, Guardrail.outcomeCodeOf(ServiceException.ofNetworkCode("ETIMEDOUT", "x")));
    assertEquals(500, Guardrail.outcomeCodeOf(new IllegalStateException("x")));
  }

  @Test
  void builderCanOnlyBeUsedOnce() {
    Guardrail.Builder builder = Guardrail.builder().auditSink(new CollectingSink());
    builder.build().close();
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void closeRejectsQueuedWorkAndFlushesAudit() {
    Guardrail queued = Guardrail.builder()
        .timeSource(time)
        .service("lab", BulkheadConfig.of(1, 5, 60_000), FAST)
        .auditSink(sink)
        .auditSecretKey("secret")
        .build();
    queued.execute("lab", CompletableFuture::new);
    CompletableFuture<Object> waiting = queued.execute("lab", CompletableFuture::new);
    queued.auditTrail().logEvent(
        AuditEntry.builder("ops", AuditAction.CONFIG_CHANGE, AuditResource.SYSTEM_CONFIG).build());
    queued.auditTrail().logEvent(
        AuditEntry.builder("ops", AuditAction.LOGIN, AuditResource.AUTHENTICATION).build());

    queued.close();

    assertTrue(waiting.isCompletedExceptionally());
    assertEquals(AuditAction.LOGIN, sink.actions().get(sink.actions().size() - 1));
    assertEquals(0, queued.auditTrail().bufferedCount());
  }

  private static final class CollectingSink implements AuditSink {
    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void appendBatch(List<AuditEvent> batch) {
      events.addAll(batch);
    }

    List<AuditAction> actions() {
      List<AuditAction> actions = new ArrayList<>();
      for (AuditEvent event : events) {
        actions.add(event.action());
      }
      return actions;
    }

    AuditEvent last(AuditAction action) {
      for (int i = events.size() - 1; i >= 0; i--) {
        if (events.get(i).action() == action) {
          return events.get(i);
        }
      }
      throw new AssertionError("no " + action + " event in " + actions());
    }
  }
}
