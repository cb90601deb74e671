package guardrail.bulkhead;

import java.util.List;

/**
 * Aggregate view over every bulkhead in a {@link BulkheadRegistry}.
 *
 * @param averageUtilization mean of the per-service utilization percentages
 * @param maxUtilization     highest per-service utilization percentage
 * @param totalActive        running operations across services
 * @param totalQueued        waiting operations across services
 * @param services           per-service statistics
 */
public record SystemUtilization(
    double averageUtilization,
    double maxUtilization,
    int totalActive,
    int totalQueued,
    List<BulkheadStats> services) {

  static SystemUtilization of(List<BulkheadStats> stats) {
    if (stats.isEmpty()) {
      return new SystemUtilization(0.0, 0.0, 0, 0, List.of());
    }
    double sum = 0.0;
    double max = 0.0;
    int active = 0;
    int queued = 0;
    for (BulkheadStats s : stats) {
      double utilization = s.utilizationPercent();
      sum += utilization;
      max = Math.max(max, utilization);
      active += s.active();
      queued += s.queued();
    }
    return new SystemUtilization(sum / stats.size(), max, active, queued, List.copyOf(stats));
  }
}
