package guardrail.audit;

import guardrail.schedule.ManualTimeSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AuditTrailTest {
  private static final String SECRET = "test-audit-secret";

  private RecordingSink sink;
  private RecordingAlerts alerts;
  private AuditTrail trail;

  @BeforeEach
  void setUp() {
    sink = new RecordingSink();
    alerts = new RecordingAlerts();
    trail = AuditTrail.builder()
        .sink(sink)
        .secretKey(SECRET)
        .bufferCapacity(3)
        .highWaterMark(5)
        .alertListener(alerts)
        .timeSource(new ManualTimeSource())
        .build();
  }

  @AfterEach
  void tearDown() {
    sink.failing = false;
    trail.close();
  }

  private static AuditEntry view(String actor) {
    return AuditEntry.builder(actor, AuditAction.PATIENT_SEARCH, AuditResource.PATIENT_DATA)
        .sessionId("sess-1")
        .build();
  }

  // ── Signing ───────────────────────────────────────────────────

  @Test
  void loggedEventVerifies() {
    AuditEvent event = trail.logEvent(view("dr.house"));

    assertTrue(trail.verify(event));
    assertEquals(64, event.integrityHash().length());
    assertNotNull(event.id());
    assertNotNull(event.timestamp());
  }

  @Test
  void tamperedEventFailsVerification() {
    AuditEvent event = trail.logEvent(view("dr.house"));

    AuditEvent tampered = new AuditEvent(event.id(), event.timestamp(), event.actorId(),
        event.sessionId(), event.subjectHash(), event.action(), event.resource(),
        event.resourceId(), 500, event.riskLevel(), event.complianceFlags(),
        event.dataClassification(), event.ipAddress(), event.durationMs(), event.errorMessage(),
        event.context(), event.correctsEventId(), event.integrityHash());

    assertFalse(trail.verify(tampered));
  }

  @Test
  void differentKeyDoesNotVerify() {
    AuditEvent event = trail.logEvent(view("dr.house"));
    AuditTrail other = AuditTrail.builder().sink(new RecordingSink()).secretKey("other").build();

    assertFalse(other.verify(event));
    other.close();
  }

  @Test
  void eventIdsIncreaseMonotonically() {
    AuditEvent first = trail.logEvent(view("a"));
    AuditEvent second = trail.logEvent(view("b"));

    assertTrue(first.id().toString().compareTo(second.id().toString()) < 0);
  }

  // ── Subjects ──────────────────────────────────────────────────

  @Test
  void rawSubjectIsReplacedByItsHash() {
    AuditEvent event = trail.logEvent(
        AuditEntry.builder("dr.house", AuditAction.PATIENT_VIEW, AuditResource.PATIENT_DATA)
            .subject("12.345.678-5")
            .build());

    assertEquals(trail.hashSubject("12.345.678-5"), event.subjectHash());
    assertFalse(event.canonicalForm().contains("12.345.678-5"));
    assertFalse(event.toString().contains("12.345.678-5"));
    assertTrue(event.consentRequired());
    assertTrue(event.complianceFlags().contains(ComplianceFlag.PERSONAL_DATA_PROCESSING));
    assertEquals(DataClassification.RESTRICTED, event.dataClassification());
  }

  @Test
  void subjectAccessUsesHashAsResourceId() {
    AuditEvent event = trail.logSubjectAccess("dr.house", "12.345.678-5", "sess-9",
        AuditAction.PATIENT_VIEW);

    assertEquals(event.subjectHash(), event.resourceId());
    assertEquals(AuditResource.PATIENT_DATA, event.resource());
    assertEquals("sess-9", event.sessionId());
    assertEquals(RiskLevel.MEDIUM, event.riskLevel());
    assertTrue(event.complianceFlags().contains(ComplianceFlag.PHI_ACCESS));
    assertEquals(Map.of("dataType", "patient_demographics"), event.context());
  }

  @Test
  void malformedSubjectHashIsRejected() {
    assertThrows(IllegalArgumentException.class, () ->
        AuditEntry.builder("x", AuditAction.PATIENT_VIEW, AuditResource.PATIENT_DATA)
            .subjectHash("not-a-hash")
            .build());
    assertThrows(IllegalArgumentException.class, () ->
        AuditEntry.builder("x", AuditAction.PATIENT_VIEW, AuditResource.PATIENT_DATA)
            .subject("12.345.678-5")
            .subjectHash("a".repeat(64))
            .build());
  }

  // ── Flushing ──────────────────────────────────────────────────

  @Test
  void criticalEventFlushesImmediately() {
    trail.logEvent(view("a"));

    AuditEvent export = trail.logEvent(
        AuditEntry.builder("dr.house", AuditAction.DATA_EXPORT, AuditResource.PATIENT_DATA).build());

    assertEquals(RiskLevel.CRITICAL, export.riskLevel());
    assertEquals(1, sink.batches.size());
    assertEquals(2, sink.batches.get(0).size());
    assertEquals(0, trail.bufferedCount());
  }

  @Test
  void fullBufferFlushesAsOneBatch() {
    trail.logEvent(view("a"));
    trail.logEvent(view("b"));
    assertTrue(sink.batches.isEmpty());

    trail.logEvent(view("c"));

    assertEquals(1, sink.batches.size());
    assertEquals(List.of("a", "b", "c"), actors(sink.batches.get(0)));
  }

  @Test
  void failedFlushRebuffersInOriginalOrder() {
    sink.failing = true;
    trail.logEvent(view("a"));
    trail.logEvent(view("b"));
    trail.logEvent(view("c"));

    assertEquals(3, trail.bufferedCount());
    assertEquals(1, alerts.flushFailures.get());

    trail.logEvent(view("d"));
    sink.failing = false;
    assertEquals(4, trail.flush());

    assertEquals(List.of("a", "b", "c", "d"), actors(sink.batches.get(0)));
    assertEquals(0, trail.bufferedCount());
  }

  @Test
  void sinkFailureDoesNotReachCaller() {
    sink.failing = true;

    AuditEvent event = trail.logEvent(
        AuditEntry.builder("dr.house", AuditAction.DATA_DELETE, AuditResource.PATIENT_DATA).build());

    assertNotNull(event);
    assertEquals(1, trail.bufferedCount());
  }

  @Test
  void highWaterMarkAlertsButKeepsEvents() {
    sink.failing = true;
    for (int i = 0; i < 6; i++) {
      trail.logEvent(view("actor-" + i));
    }

    assertEquals(6, trail.bufferedCount());
    assertEquals(List.of(5, 6), alerts.highWater);
  }

  @Test
  void emptyFlushWritesNothing() {
    assertEquals(0, trail.flush());
    assertTrue(sink.batches.isEmpty());
  }

  @Test
  void closeFlushesRemainingAndRejectsFurtherEvents() {
    trail.logEvent(view("a"));

    trail.close();

    assertEquals(1, sink.batches.size());
    assertThrows(IllegalStateException.class, () -> trail.logEvent(view("b")));
    assertThrows(IllegalStateException.class, trail::start);
  }

  @Test
  void eventsAcceptedWhileClosingAreAllWritten() throws Exception {
    AuditTrail closing = AuditTrail.builder()
        .sink(sink)
        .secretKey(SECRET)
        .bufferCapacity(50)
        .highWaterMark(100_000)
        .build();
    int writers = 6;
    Queue<AuditEvent> accepted = new ConcurrentLinkedQueue<>();
    AtomicInteger refused = new AtomicInteger();
    CountDownLatch running = new CountDownLatch(writers);
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    try {
      for (int w = 0; w < writers; w++) {
        String actor = "writer-" + w;
        pool.execute(() -> {
          running.countDown();
          while (true) {
            try {
              accepted.add(closing.logEvent(view(actor)));
            } catch (IllegalStateException e) {
              refused.incrementAndGet();
              return;
            }
          }
        });
      }
      assertTrue(running.await(5, TimeUnit.SECONDS));
      Thread.sleep(20);

      closing.close();

      pool.shutdown();
      assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }

    Set<UUID> written = new HashSet<>();
    for (List<AuditEvent> batch : sink.batches) {
      for (AuditEvent event : batch) {
        written.add(event.id());
      }
    }
    assertEquals(writers, refused.get());
    assertFalse(accepted.isEmpty());
    assertEquals(accepted.size(), written.size());
    for (AuditEvent event : accepted) {
      assertTrue(written.contains(event.id()), "missing " + event.id());
    }
    assertEquals(0, closing.bufferedCount());
  }

  @Test
  void periodicFlushRunsAfterStart() throws Exception {
    AuditTrail periodic = AuditTrail.builder()
        .sink(sink)
        .secretKey(SECRET)
        .flushInterval(Duration.ofMillis(20))
        .build();
    periodic.start();
    periodic.logEvent(view("a"));

    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (sink.batches.isEmpty() && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    periodic.close();

    assertEquals(List.of("a"), actors(sink.batches.get(0)));
  }

  // ── Corrections ───────────────────────────────────────────────

  @Test
  void correctionReferencesOriginalAndLeavesItIntact() {
    AuditEvent original = trail.logEvent(view("dr.house"));

    AuditEvent correction = trail.logCorrection(original,
        AuditEntry.builder("dr.house", AuditAction.PATIENT_SEARCH, AuditResource.PATIENT_DATA)
            .outcomeCode(404)
            .build());

    assertEquals(original.id(), correction.correctsEventId());
    assertTrue(trail.verify(original));
    assertTrue(trail.verify(correction));
    assertEquals(200, original.outcomeCode());
  }

  // ── Risk and logging helpers ──────────────────────────────────

  @Test
  void riskOverrideWins() {
    AuditEvent event = trail.logEvent(
        AuditEntry.builder("x", AuditAction.LOGIN, AuditResource.AUTHENTICATION)
            .riskLevel(RiskLevel.HIGH)
            .build());

    assertEquals(RiskLevel.HIGH, event.riskLevel());
    assertTrue(event.complianceFlags().contains(ComplianceFlag.REQUIRES_REVIEW));
  }

  @Test
  void actorIdsAreAnonymizedForLogs() {
    assertEquals("dr******se", AuditTrail.anonymizeActorId("dr.housese"));
    assertEquals("ab*de", AuditTrail.anonymizeActorId("abcde"));
    assertEquals("****", AuditTrail.anonymizeActorId("abcd"));
  }

  @Test
  void builderValidatesLimits() {
    assertThrows(IllegalArgumentException.class,
        () -> AuditTrail.builder().bufferCapacity(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> AuditTrail.builder().bufferCapacity(10).highWaterMark(5).build());
    assertThrows(IllegalArgumentException.class,
        () -> AuditTrail.builder().flushInterval(Duration.ZERO).build());
  }

  private static List<String> actors(List<AuditEvent> events) {
    List<String> actors = new ArrayList<>();
    for (AuditEvent event : events) {
      actors.add(event.actorId());
    }
    return actors;
  }

  private static final class RecordingSink implements AuditSink {
    private final List<List<AuditEvent>> batches = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void appendBatch(List<AuditEvent> events) throws AuditSinkException {
      if (failing) {
        throw new AuditSinkException("audit store unavailable");
      }
      batches.add(List.copyOf(events));
    }
  }

  private static final class RecordingAlerts implements AuditAlertListener {
    private final List<Integer> highWater = new CopyOnWriteArrayList<>();
    private final AtomicInteger flushFailures = new AtomicInteger();

    @Override
    public void onBufferHighWater(int buffered, int highWaterMark) {
      highWater.add(buffered);
    }

    @Override
    public void onFlushFailure(int batchSize, Exception error) {
      flushFailures.incrementAndGet();
    }
  }
}
