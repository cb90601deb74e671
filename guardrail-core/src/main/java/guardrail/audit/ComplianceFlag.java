package guardrail.audit;

import java.util.EnumSet;
import java.util.Set;

/**
 * Regulatory markers derived from an audit event.
 */
public enum ComplianceFlag {
  /** Protected health information was read or written. */
  PHI_ACCESS,
  /** Protected health information left the system. */
  PHI_DISCLOSURE,
  /** The event concerns an identifiable data subject. */
  PERSONAL_DATA_PROCESSING,
  /** A national identity number was processed. */
  NATIONAL_ID_PROCESSING,
  /** The event must be looked at by a compliance officer. */
  REQUIRES_REVIEW;

  static Set<ComplianceFlag> derive(AuditAction action, boolean hasSubject, RiskLevel risk) {
    EnumSet<ComplianceFlag> flags = EnumSet.noneOf(ComplianceFlag.class);
    if (action.accessesPhi()) {
      flags.add(PHI_ACCESS);
    }
    if (action.disclosesPhi()) {
      flags.add(PHI_DISCLOSURE);
    }
    if (hasSubject) {
      flags.add(PERSONAL_DATA_PROCESSING);
    }
    if (action == AuditAction.NATIONAL_ID_VALIDATION) {
      flags.add(NATIONAL_ID_PROCESSING);
    }
    if (risk.requiresReview()) {
      flags.add(REQUIRES_REVIEW);
    }
    return flags;
  }
}
