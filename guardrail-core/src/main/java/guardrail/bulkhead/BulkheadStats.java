package guardrail.bulkhead;

/**
 * Point-in-time statistics for one bulkhead. All counters are cumulative since creation.
 *
 * @param serviceName            the service the bulkhead protects
 * @param config                 the bulkhead's limits
 * @param active                 operations running now
 * @param queued                 operations waiting now
 * @param totalExecuted          operations that finished running, successfully or not
 * @param totalQueued            operations that had to wait
 * @param totalTimeouts          queued operations rejected by the wait timeout
 * @param totalRejectedQueueFull requests rejected because the queue was full
 * @param totalCleared           queued operations cancelled by a queue clear
 * @param averageExecutionMillis mean run time of executed operations
 */
public record BulkheadStats(
    String serviceName,
    BulkheadConfig config,
    int active,
    int queued,
    long totalExecuted,
    long totalQueued,
    long totalTimeouts,
    long totalRejectedQueueFull,
    long totalCleared,
    double averageExecutionMillis) {

  public double utilizationPercent() {
    return active * 100.0 / config.maxConcurrency();
  }

  public double queueUtilizationPercent() {
    return config.queueCapacity() == 0 ? 0.0 : queued * 100.0 / config.queueCapacity();
  }
}
