package guardrail.audit;

import java.util.Locale;

/**
 * Auditable operations, each with a fixed base risk.
 *
 * <p>Actions without an intrinsic risk ({@code baseRisk() == null}) are rated from the outcome
 * code instead; see {@link #riskFor(int)}.
 */
public enum AuditAction {
  LOGIN,
  LOGOUT,
  LOGIN_FAILED,
  PASSWORD_RESET,
  SESSION_START,
  SESSION_END,
  SESSION_TIMEOUT,
  PATIENT_VIEW(RiskLevel.MEDIUM),
  PATIENT_CREATE(RiskLevel.HIGH),
  PATIENT_UPDATE(RiskLevel.HIGH),
  PATIENT_SEARCH,
  ANALYSIS_START(RiskLevel.MEDIUM),
  ANALYSIS_COMPLETE(RiskLevel.HIGH),
  ANALYSIS_VIEW(RiskLevel.MEDIUM),
  ANALYSIS_EXPORT,
  DATA_EXPORT(RiskLevel.CRITICAL),
  DATA_IMPORT,
  DATA_DELETE(RiskLevel.CRITICAL),
  DATA_BACKUP,
  PERMISSION_GRANT(RiskLevel.CRITICAL),
  PERMISSION_REVOKE,
  CONFIG_CHANGE(RiskLevel.CRITICAL),
  SECURITY_VIOLATION,
  UNAUTHORIZED_ACCESS,
  SUSPICIOUS_ACTIVITY,
  NATIONAL_ID_VALIDATION,
  MEDICAL_LICENSE_CHECK,
  NATIONAL_REGISTRY_QUERY;

  private final RiskLevel baseRisk;

  AuditAction() {
    this(null);
  }

  AuditAction(RiskLevel baseRisk) {
    this.baseRisk = baseRisk;
  }

  /**
   * @return the intrinsic risk of this action, or null if it depends on the outcome
   */
  public RiskLevel baseRisk() {
    return baseRisk;
  }

  /**
   * Rates an occurrence of this action.
   *
   * @param outcomeCode HTTP-like outcome; &ge; 500 is CRITICAL, &ge; 400 is HIGH
   */
  public RiskLevel riskFor(int outcomeCode) {
    if (baseRisk != null) {
      return baseRisk;
    }
    if (outcomeCode >= 500) {
      return RiskLevel.CRITICAL;
    }
    if (outcomeCode >= 400) {
      return RiskLevel.HIGH;
    }
    return RiskLevel.LOW;
  }

  /**
   * Touches protected health information.
   */
  public boolean accessesPhi() {
    return switch (this) {
      case PATIENT_VIEW, PATIENT_CREATE, PATIENT_UPDATE, ANALYSIS_VIEW -> true;
      default -> false;
    };
  }

  /**
   * Releases protected health information outside the system.
   */
  public boolean disclosesPhi() {
    return this == DATA_EXPORT || this == ANALYSIS_EXPORT;
  }

  /**
   * Lower-case identifier used in the integrity hash and log output, e.g. {@code patient_view}.
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
