package guardrail.audit;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sink that writes batch summaries and per-event lines to {@code java.util.logging}.
 *
 * <p>Used when no durable sink is configured. Nothing is persisted.
 */
public final class LoggingAuditSink implements AuditSink {
  private static final Logger logger = Logger.getLogger(LoggingAuditSink.class.getName());

  @Override
  public void appendBatch(List<AuditEvent> events) {
    long highRisk = events.stream().filter(e -> e.riskLevel().requiresReview()).count();
    logger.log(Level.INFO, "Audit batch: {0} events, {1} high risk",
        new Object[]{events.size(), highRisk});
    if (logger.isLoggable(Level.FINE)) {
      for (AuditEvent event : events) {
        logger.fine(event.canonicalForm() + " hash=" + event.integrityHash());
      }
    }
  }
}
