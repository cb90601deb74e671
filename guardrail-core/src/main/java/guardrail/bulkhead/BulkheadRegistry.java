package guardrail.bulkhead;

import guardrail.AsyncOperation;
import guardrail.schedule.DeadlineScheduler;
import guardrail.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lazily creates and caches one {@link Bulkhead} per service name.
 *
 * <p>A bulkhead lives as long as the registry. Its configuration is taken from the per-service
 * overrides registered on the builder, or the default config otherwise, and never changes.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class BulkheadRegistry implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BulkheadRegistry.class.getName());

  private final DeadlineScheduler scheduler;
  private final BulkheadConfig defaultConfig;
  private final Map<String, BulkheadConfig> serviceConfigs;
  private final BulkheadListener listener;
  private final MetricsExporter metrics;
  private final Executor executor;
  private final ConcurrentHashMap<String, Bulkhead> bulkheads = new ConcurrentHashMap<>();

  private BulkheadRegistry(Builder builder) {
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.defaultConfig = builder.defaultConfig != null
        ? builder.defaultConfig
        : new BulkheadConfig(5, 20, Duration.ofSeconds(10));
    this.serviceConfigs = Map.copyOf(builder.serviceConfigs);
    this.listener = builder.listener != null ? builder.listener : BulkheadListener.NOOP;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.executor = builder.executor != null ? builder.executor : ForkJoinPool.commonPool();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the bulkhead for {@code serviceName}, creating it on first use.
   */
  public Bulkhead bulkhead(String serviceName) {
    Objects.requireNonNull(serviceName, "serviceName");
    return bulkheads.computeIfAbsent(serviceName,
        name -> create(name, serviceConfigs.getOrDefault(name, defaultConfig)));
  }

  /**
   * Returns the bulkhead for {@code serviceName}, creating it with {@code config} on first use.
   *
   * @throws IllegalStateException if the bulkhead already exists with a different config
   */
  public Bulkhead bulkhead(String serviceName, BulkheadConfig config) {
    Objects.requireNonNull(serviceName, "serviceName");
    Objects.requireNonNull(config, "config");
    Bulkhead bulkhead = bulkheads.computeIfAbsent(serviceName, name -> create(name, config));
    if (!bulkhead.config().equals(config)) {
      throw new IllegalStateException("Bulkhead '" + serviceName
          + "' already exists with config " + bulkhead.config());
    }
    return bulkhead;
  }

  private Bulkhead create(String name, BulkheadConfig config) {
    logger.log(Level.INFO, "Created bulkhead [{0}] maxConcurrency={1} queueCapacity={2} waitTimeout={3}ms",
        new Object[]{name, config.maxConcurrency(), config.queueCapacity(),
            config.waitTimeout().toMillis()});
    return new Bulkhead(name, config, scheduler, listener, metrics, executor);
  }

  /**
   * Runs {@code operation} through the bulkhead for {@code serviceName}.
   */
  public <T> CompletableFuture<T> execute(String serviceName, AsyncOperation<T> operation) {
    return bulkhead(serviceName).execute(operation);
  }

  /**
   * @return stats of every bulkhead created so far, keyed by service name
   */
  public Map<String, BulkheadStats> allStats() {
    Map<String, BulkheadStats> stats = new HashMap<>();
    bulkheads.forEach((name, bulkhead) -> stats.put(name, bulkhead.stats()));
    return stats;
  }

  public SystemUtilization systemUtilization() {
    return SystemUtilization.of(new ArrayList<>(allStats().values()));
  }

  /**
   * @param thresholdPercent utilization at or above which a service is reported
   * @return service names sorted by descending utilization
   */
  public List<String> highUtilizationServices(double thresholdPercent) {
    List<BulkheadStats> hot = new ArrayList<>();
    for (BulkheadStats stats : allStats().values()) {
      if (stats.utilizationPercent() >= thresholdPercent) {
        hot.add(stats);
      }
    }
    hot.sort(Comparator.comparingDouble(BulkheadStats::utilizationPercent).reversed());
    List<String> names = new ArrayList<>(hot.size());
    for (BulkheadStats stats : hot) {
      names.add(stats.serviceName());
    }
    return names;
  }

  /**
   * Clears the queue of every bulkhead.
   *
   * @return the total number of operations cancelled
   */
  public int clearAllQueues(String reason) {
    int total = 0;
    for (Bulkhead bulkhead : bulkheads.values()) {
      total += bulkhead.clearQueue(reason);
    }
    return total;
  }

  /**
   * Rejects all queued operations. Running operations complete normally.
   */
  @Override
  public void close() {
    int cleared = clearAllQueues("Shutting down");
    if (cleared > 0) {
      logger.log(Level.INFO, "Rejected {0} queued operations on shutdown", cleared);
    }
  }

  /** Builder for {@link BulkheadRegistry}. */
  public static final class Builder {
    private DeadlineScheduler scheduler;
    private BulkheadConfig defaultConfig;
    private final Map<String, BulkheadConfig> serviceConfigs = new HashMap<>();
    private BulkheadListener listener;
    private MetricsExporter metrics;
    private Executor executor;

    private Builder() {}

    /**
     * Sets the scheduler that runs queue wait timeouts.
     *
     * <p><b>Required.</b>
     */
    public Builder scheduler(DeadlineScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Config for services without an explicit entry.
     *
     * <p>Optional. Defaults to {@code {5, 20, 10s}}.
     */
    public Builder defaultConfig(BulkheadConfig defaultConfig) {
      this.defaultConfig = defaultConfig;
      return this;
    }

    public Builder serviceConfig(String serviceName, BulkheadConfig config) {
      this.serviceConfigs.put(Objects.requireNonNull(serviceName, "serviceName"),
          Objects.requireNonNull(config, "config"));
      return this;
    }

    public Builder listener(BulkheadListener listener) {
      this.listener = listener;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Executor that fails timed-out callers and notifies the listener about it.
     *
     * <p>Optional. Defaults to the common pool.
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * @throws NullPointerException if {@code scheduler} is null
     */
    public BulkheadRegistry build() {
      return new BulkheadRegistry(this);
    }
  }
}
