package guardrail.bulkhead;

import guardrail.schedule.DeadlineScheduler;
import guardrail.schedule.ManualTimeSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class BulkheadRegistryTest {
  private final DeadlineScheduler scheduler = new DeadlineScheduler(new ManualTimeSource());

  @Test
  void sameNameReturnsSameBulkhead() {
    BulkheadRegistry registry = BulkheadRegistry.builder().scheduler(scheduler).build();

    assertSame(registry.bulkhead("pacs"), registry.bulkhead("pacs"));
    assertNotSame(registry.bulkhead("pacs"), registry.bulkhead("lab"));
  }

  @Test
  void unknownServiceUsesDefaultConfig() {
    BulkheadRegistry registry = BulkheadRegistry.builder().scheduler(scheduler).build();

    assertEquals(new BulkheadConfig(5, 20, Duration.ofSeconds(10)),
        registry.bulkhead("anything").config());
  }

  @Test
  void serviceConfigOverridesDefault() {
    BulkheadConfig critical = BulkheadConfig.of(10, 50, 5000);
    BulkheadRegistry registry = BulkheadRegistry.builder()
        .scheduler(scheduler)
        .defaultConfig(BulkheadConfig.of(2, 10, 30_000))
        .serviceConfig("radiography-analysis", critical)
        .build();

    assertEquals(critical, registry.bulkhead("radiography-analysis").config());
    assertEquals(BulkheadConfig.of(2, 10, 30_000), registry.bulkhead("email").config());
  }

  @Test
  void explicitConfigMismatchIsRejected() {
    BulkheadRegistry registry = BulkheadRegistry.builder().scheduler(scheduler).build();
    registry.bulkhead("pacs", BulkheadConfig.of(1, 1, 1000));

    assertSame(registry.bulkhead("pacs"), registry.bulkhead("pacs", BulkheadConfig.of(1, 1, 1000)));
    assertThrows(IllegalStateException.class,
        () -> registry.bulkhead("pacs", BulkheadConfig.of(2, 1, 1000)));
  }

  @Test
  void schedulerIsRequired() {
    assertThrows(NullPointerException.class, () -> BulkheadRegistry.builder().build());
  }

  @Test
  void utilizationAcrossServices() {
    BulkheadRegistry registry = BulkheadRegistry.builder()
        .scheduler(scheduler)
        .serviceConfig("a", BulkheadConfig.of(2, 5, 5000))
        .serviceConfig("b", BulkheadConfig.of(4, 5, 5000))
        .serviceConfig("c", BulkheadConfig.of(4, 5, 5000))
        .build();
    registry.execute("a", CompletableFuture::new);
    registry.execute("a", CompletableFuture::new);
    registry.execute("a", CompletableFuture::new);
    registry.execute("b", CompletableFuture::new);
    registry.execute("b", CompletableFuture::new);
    registry.bulkhead("c");

    SystemUtilization utilization = registry.systemUtilization();

    assertEquals(3, utilization.services().size());
    assertEquals(100.0, utilization.maxUtilization(), 0.001);
    assertEquals(50.0, utilization.averageUtilization(), 0.001);
    assertEquals(4, utilization.totalActive());
    assertEquals(1, utilization.totalQueued());
    assertEquals(List.of("a", "b"), registry.highUtilizationServices(50.0));
    assertEquals(List.of("a"), registry.highUtilizationServices(80.0));

    Map<String, BulkheadStats> stats = registry.allStats();
    assertEquals(1, stats.get("a").queued());
    assertEquals(0, stats.get("c").active());
  }

  @Test
  void emptyRegistryReportsZeroUtilization() {
    BulkheadRegistry registry = BulkheadRegistry.builder().scheduler(scheduler).build();

    SystemUtilization utilization = registry.systemUtilization();

    assertEquals(0.0, utilization.averageUtilization());
    assertTrue(utilization.services().isEmpty());
  }

  @Test
  void closeRejectsQueuedOperationsEverywhere() {
    BulkheadRegistry registry = BulkheadRegistry.builder()
        .scheduler(scheduler)
        .defaultConfig(BulkheadConfig.of(1, 5, 5000))
        .build();
    registry.execute("a", CompletableFuture::new);
    CompletableFuture<Object> queuedA = registry.execute("a", CompletableFuture::new);
    registry.execute("b", CompletableFuture::new);
    CompletableFuture<Object> queuedB = registry.execute("b", CompletableFuture::new);

    registry.close();

    for (CompletableFuture<Object> queued : List.of(queuedA, queuedB)) {
      ExecutionException e = assertThrows(ExecutionException.class, queued::get);
      QueueClearedException cleared = assertInstanceOf(QueueClearedException.class, e.getCause());
      assertEquals("Shutting down", cleared.reason());
    }
    assertEquals(0, scheduler.pendingCount());
  }
}
