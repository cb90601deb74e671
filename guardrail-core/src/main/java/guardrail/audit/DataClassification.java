package guardrail.audit;

/**
 * Sensitivity of the data an audited operation touched.
 */
public enum DataClassification {
  PUBLIC,
  CONFIDENTIAL,
  RESTRICTED,
  SECRET;

  static DataClassification classify(AuditAction action, boolean hasSubject) {
    if (action == AuditAction.MEDICAL_LICENSE_CHECK) {
      return SECRET;
    }
    if (hasSubject) {
      return RESTRICTED;
    }
    if (action == AuditAction.PATIENT_VIEW || action == AuditAction.PATIENT_CREATE) {
      return CONFIDENTIAL;
    }
    return PUBLIC;
  }
}
