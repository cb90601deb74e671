package guardrail.audit;

/**
 * Severity of an audited operation. Ordered from least to most severe.
 */
public enum RiskLevel {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * @return true for {@link #HIGH} and {@link #CRITICAL}
   */
  public boolean requiresReview() {
    return this == HIGH || this == CRITICAL;
  }
}
