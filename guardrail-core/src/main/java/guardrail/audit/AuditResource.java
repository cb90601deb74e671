package guardrail.audit;

import java.util.Locale;

/**
 * Kind of object an audited operation touched.
 */
public enum AuditResource {
  AUTHENTICATION,
  PATIENT_DATA,
  MEDICAL_ANALYSIS,
  MEDICAL_SESSION,
  DOCTOR_PROFILE,
  SYSTEM_CONFIG,
  AUDIT_LOG,
  ENCRYPTED_RECORD,
  NATIONAL_REGISTRY,
  WORKFLOW,
  FILE_UPLOAD,
  RADIOGRAPHY_IMAGE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
